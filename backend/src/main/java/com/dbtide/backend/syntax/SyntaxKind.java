package com.dbtide.backend.syntax;

/**
 * Kinds of the elements of a {@link SyntaxTree}.
 *
 * <p>The first constants mirror {@link TokenKind} one-to-one, with identical names and in the same
 * order, so that a token is lifted into the tree by {@link KindTable#leaf(TokenKind)} without any
 * further classification. {@link #ERROR} is shared by error leaves and synthesized error composites.
 */
public enum SyntaxKind {

    // leaves, mirroring TokenKind
    EQUAL(Category.TOKEN),
    GREATER_THAN(Category.TOKEN),
    GREATER_THAN_OR_EQUAL(Category.TOKEN),
    LESS_THAN(Category.TOKEN),
    LESS_THAN_OR_EQUAL(Category.TOKEN),
    NOT_EQUAL(Category.TOKEN),
    ADD(Category.TOKEN),
    ASSIGN(Category.TOKEN),
    COLON(Category.TOKEN),
    COMMA(Category.TOKEN),
    DIV(Category.TOKEN),
    DOT(Category.TOKEN),
    FLOOR_DIV(Category.TOKEN),
    LEFT_BRACE(Category.TOKEN),
    LEFT_BRACKET(Category.TOKEN),
    LEFT_PAREN(Category.TOKEN),
    MODULO(Category.TOKEN),
    MULTIPLY(Category.TOKEN),
    PIPE(Category.TOKEN),
    POWER(Category.TOKEN),
    RIGHT_BRACE(Category.TOKEN),
    RIGHT_BRACKET(Category.TOKEN),
    RIGHT_PAREN(Category.TOKEN),
    SEMICOLON(Category.TOKEN),
    SUBTRACT(Category.TOKEN),
    TILDE(Category.TOKEN),
    WHITESPACE(Category.TOKEN),
    FLOAT_LITERAL(Category.TOKEN),
    INTEGER_LITERAL(Category.TOKEN),
    STRING_LITERAL(Category.TOKEN),
    NAME(Category.TOKEN),
    RAW_BEGIN(Category.TOKEN),
    RAW_END(Category.TOKEN),
    COMMENT_BEGIN(Category.TOKEN),
    COMMENT_END(Category.TOKEN),
    BLOCK_BEGIN(Category.TOKEN),
    BLOCK_END(Category.TOKEN),
    VARIABLE_BEGIN(Category.TOKEN),
    VARIABLE_END(Category.TOKEN),
    COMMENT_DATA(Category.TOKEN),
    DATA(Category.TOKEN),
    ERROR(Category.ERROR),

    // statements
    STMT_EXTENDS(Category.STATEMENT),
    STMT_FOR(Category.STATEMENT),
    STMT_IF(Category.STATEMENT),
    STMT_MACRO(Category.STATEMENT),
    STMT_RAW(Category.STATEMENT),
    STMT_CALL_BLOCK(Category.STATEMENT),
    STMT_FILTER_BLOCK(Category.STATEMENT),
    STMT_WITH(Category.STATEMENT),
    STMT_BLOCK(Category.STATEMENT),
    STMT_INCLUDE(Category.STATEMENT),
    STMT_IMPORT(Category.STATEMENT),
    STMT_FROM_IMPORT(Category.STATEMENT),
    STMT_DO(Category.STATEMENT),
    STMT_ASSIGN(Category.STATEMENT),
    STMT_ASSIGN_BLOCK(Category.STATEMENT),
    STMT_MATERIALIZATION(Category.STATEMENT),
    STMT_DOCS(Category.STATEMENT),
    STMT_TEST(Category.STATEMENT),
    STMT_SNAPSHOT(Category.STATEMENT),
    STMT_UNKNOWN(Category.STATEMENT),

    // expressions
    EXPR_NAME(Category.EXPRESSION),
    EXPR_NESTED_NAME(Category.EXPRESSION),
    EXPR_NAMESPACE_REF(Category.EXPRESSION),
    EXPR_CONSTANT_BOOL(Category.EXPRESSION),
    EXPR_CONSTANT_NONE(Category.EXPRESSION),
    EXPR_CONSTANT_STRING(Category.EXPRESSION),
    EXPR_CONSTANT_INTEGER(Category.EXPRESSION),
    EXPR_CONSTANT_FLOAT(Category.EXPRESSION),
    EXPR_WRAPPED(Category.EXPRESSION),
    EXPR_DATA(Category.EXPRESSION),
    EXPR_TUPLE(Category.EXPRESSION),
    EXPR_LIST(Category.EXPRESSION),
    EXPR_DICT(Category.EXPRESSION),
    EXPR_TERNARY(Category.EXPRESSION),
    EXPR_FILTER(Category.EXPRESSION),
    EXPR_FILTER_NAME(Category.EXPRESSION),
    EXPR_TEST(Category.EXPRESSION),
    EXPR_CALL(Category.EXPRESSION),
    EXPR_GET_ITEM(Category.EXPRESSION),
    EXPR_GET_ATTR(Category.EXPRESSION),
    EXPR_SLICE(Category.EXPRESSION),
    EXPR_CONCAT(Category.EXPRESSION),
    EXPR_COMPARE(Category.EXPRESSION),
    EXPR_MULTIPLY(Category.EXPRESSION),
    EXPR_DIVIDE(Category.EXPRESSION),
    EXPR_FLOOR_DIVIDE(Category.EXPRESSION),
    EXPR_ADD(Category.EXPRESSION),
    EXPR_SUBTRACT(Category.EXPRESSION),
    EXPR_MODULO(Category.EXPRESSION),
    EXPR_POWER(Category.EXPRESSION),
    EXPR_AND(Category.EXPRESSION),
    EXPR_OR(Category.EXPRESSION),
    EXPR_NOT(Category.EXPRESSION),
    EXPR_NEGATIVE(Category.EXPRESSION),
    EXPR_POSITIVE(Category.EXPRESSION),

    // keywords acting as operators
    NAME_OPERATOR_OR(Category.NAME_OPERATOR),
    NAME_OPERATOR_AND(Category.NAME_OPERATOR),
    NAME_OPERATOR_NOT(Category.NAME_OPERATOR),
    NAME_OPERATOR_IF(Category.NAME_OPERATOR),
    NAME_OPERATOR_ELSE(Category.NAME_OPERATOR),
    NAME_OPERATOR_IN(Category.NAME_OPERATOR),
    NAME_OPERATOR_IS(Category.NAME_OPERATOR),
    NAME_OPERATOR_NOT_IN(Category.NAME_OPERATOR),

    // composites
    TEMPLATE(Category.COMPOSITE),
    VARIABLE(Category.COMPOSITE),
    COMMENT(Category.COMPOSITE),
    PAIR(Category.COMPOSITE),
    OPERAND(Category.COMPOSITE),
    SUBSCRIPT(Category.COMPOSITE),
    TEST_ARGUMENTS(Category.COMPOSITE),
    CALL_ARGUMENTS(Category.COMPOSITE),
    CALL_DYNAMIC_ARGS(Category.COMPOSITE),
    CALL_DYNAMIC_KWARGS(Category.COMPOSITE),
    CALL_STATIC_ARG(Category.COMPOSITE),
    CALL_STATIC_KWARG(Category.COMPOSITE),
    SIGNATURE(Category.COMPOSITE),
    SIGNATURE_ARG(Category.COMPOSITE),
    SIGNATURE_DEFAULT_ARG(Category.COMPOSITE),
    WITH_ASSIGNMENT(Category.COMPOSITE),
    IMPORT_NAME(Category.COMPOSITE),
    FOR_START(Category.BLOCK_MARKER),
    FOR_ELSE(Category.BLOCK_MARKER),
    FOR_END(Category.BLOCK_MARKER),
    IF_START(Category.BLOCK_MARKER),
    IF_ELIF(Category.BLOCK_MARKER),
    IF_ELSE(Category.BLOCK_MARKER),
    IF_END(Category.BLOCK_MARKER),
    ASSIGN_BLOCK_START(Category.BLOCK_MARKER),
    ASSIGN_BLOCK_END(Category.BLOCK_MARKER),
    CALL_BLOCK_START(Category.BLOCK_MARKER),
    CALL_BLOCK_END(Category.BLOCK_MARKER),
    FILTER_BLOCK_START(Category.BLOCK_MARKER),
    FILTER_BLOCK_END(Category.BLOCK_MARKER),
    WITH_BLOCK_START(Category.BLOCK_MARKER),
    WITH_BLOCK_END(Category.BLOCK_MARKER),
    NAMED_BLOCK_START(Category.BLOCK_MARKER),
    NAMED_BLOCK_END(Category.BLOCK_MARKER),
    MACRO_BLOCK_START(Category.BLOCK_MARKER),
    MACRO_BLOCK_END(Category.BLOCK_MARKER),
    MATERIALIZATION_BLOCK_START(Category.BLOCK_MARKER),
    MATERIALIZATION_BLOCK_END(Category.BLOCK_MARKER),
    MATERIALIZATION_DEFAULT(Category.COMPOSITE),
    MATERIALIZATION_ADAPTER(Category.COMPOSITE),
    TEST_BLOCK_START(Category.BLOCK_MARKER),
    TEST_BLOCK_END(Category.BLOCK_MARKER),
    DOCS_BLOCK_START(Category.BLOCK_MARKER),
    DOCS_BLOCK_END(Category.BLOCK_MARKER),
    SNAPSHOT_BLOCK_START(Category.BLOCK_MARKER),
    SNAPSHOT_BLOCK_END(Category.BLOCK_MARKER);

    public enum Category {
        TOKEN,
        ERROR,
        STATEMENT,
        EXPRESSION,
        NAME_OPERATOR,
        COMPOSITE,
        BLOCK_MARKER
    }

    private final Category category;

    SyntaxKind(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    public boolean isStatement() {
        return category == Category.STATEMENT;
    }

    public boolean isError() {
        return this == ERROR;
    }
}
