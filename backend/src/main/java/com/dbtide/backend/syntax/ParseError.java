package com.dbtide.backend.syntax;

/**
 * A problem found while parsing, kept next to the tree instead of aborting the parse.
 *
 * @param expected the token kind the parser was looking for, when there was a single one
 * @param found    the token kind that was found instead, when there was a token at all
 */
public record ParseError(TextRange range, String message, Category category, TokenKind expected, TokenKind found) {

    public enum Category {
        /** A character no lexer rule accepts. */
        LEXICAL,
        /** An unexpected or missing token inside an expression or statement. */
        SYNTAX,
        /** A block opener without its closer, or a closer without its opener. */
        STRUCTURAL
    }

    public static ParseError lexical(TextRange range, String message) {
        return new ParseError(range, message, Category.LEXICAL, null, TokenKind.ERROR);
    }

    public static ParseError syntax(TextRange range, String message) {
        return new ParseError(range, message, Category.SYNTAX, null, null);
    }

    public static ParseError syntax(TextRange range, String message, TokenKind expected, TokenKind found) {
        return new ParseError(range, message, Category.SYNTAX, expected, found);
    }

    public static ParseError structural(TextRange range, String message) {
        return new ParseError(range, message, Category.STRUCTURAL, null, null);
    }

    @Override
    public String toString() {
        return category + " " + range + ": " + message;
    }
}
