package com.dbtide.backend.syntax;

/**
 * Terminal kinds produced by the {@link Lexer}.
 *
 * <p>Declaration order is the numeric identity of each kind (see {@link KindTable#id(TokenKind)}),
 * so new kinds go at the end of their group and existing ones are never reordered.
 */
public enum TokenKind {

    // comparisons
    EQUAL("=="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    NOT_EQUAL("!="),

    // operators
    ADD("+"),
    ASSIGN("="),
    COLON(":"),
    COMMA(","),
    DIV("/"),
    DOT("."),
    FLOOR_DIV("//"),
    LEFT_BRACE("{"),
    LEFT_BRACKET("["),
    LEFT_PAREN("("),
    MODULO("%"),
    MULTIPLY("*"),
    PIPE("|"),
    POWER("**"),
    RIGHT_BRACE("}"),
    RIGHT_BRACKET("]"),
    RIGHT_PAREN(")"),
    SEMICOLON(";"),
    SUBTRACT("-"),
    TILDE("~"),

    // everything else
    WHITESPACE(null),
    FLOAT_LITERAL(null),
    INTEGER_LITERAL(null),
    STRING_LITERAL(null),
    NAME(null),
    RAW_BEGIN(null),
    RAW_END(null),
    COMMENT_BEGIN(null),
    COMMENT_END(null),
    BLOCK_BEGIN(null),
    BLOCK_END(null),
    VARIABLE_BEGIN(null),
    VARIABLE_END(null),
    COMMENT_DATA(null),
    DATA(null),
    ERROR(null);

    private final String symbol;

    TokenKind(String symbol) {
        this.symbol = symbol;
    }

    /** Fixed source text of an operator or comparison, {@code null} for every other kind. */
    public String symbol() {
        return symbol;
    }

    public boolean isComparison() {
        return ordinal() <= NOT_EQUAL.ordinal();
    }

    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT_BEGIN || this == COMMENT_DATA || this == COMMENT_END;
    }
}
