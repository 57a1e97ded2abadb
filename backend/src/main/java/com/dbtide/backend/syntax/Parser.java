package com.dbtide.backend.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Recovering recursive-descent parser producing a lossless {@link SyntaxTree}.
 *
 * <p>Statements are dispatched on the keyword following {@code {%}. Block statements stay open on a stack
 * until their closer arrives; their body elements become children of the open statement node. Expressions
 * follow Jinja's precedence ladder, lowest first: conditional, {@code or}, {@code and}, {@code not},
 * comparisons, {@code + -}, {@code ~}, {@code * / // %}, unary {@code - +}, {@code **} (right-associative)
 * and finally primaries with their postfix accessors, calls, filters and tests.
 *
 * <p>Malformed input never stops the parse. Unexpected tokens become {@code ERROR} leaves, blocks left open
 * are finished as {@code ERROR} composites, and every problem is reported as a {@link ParseError}. The only
 * exception ever thrown is {@link CancellationException}, and only when the caller's cancellation check
 * reports true.
 */
public final class Parser {

    private static final int MAX_EXPRESSION_DEPTH = 200;

    /** Tokens an expression or statement never consumes past. */
    private static final Set<TokenKind> BOUNDARIES = EnumSet.of(
            TokenKind.VARIABLE_END, TokenKind.BLOCK_END,
            TokenKind.VARIABLE_BEGIN, TokenKind.BLOCK_BEGIN,
            TokenKind.COMMENT_BEGIN, TokenKind.COMMENT_DATA, TokenKind.COMMENT_END,
            TokenKind.RAW_BEGIN, TokenKind.RAW_END, TokenKind.DATA);

    private static final Set<TokenKind> CLOSERS = EnumSet.of(
            TokenKind.RIGHT_PAREN, TokenKind.RIGHT_BRACKET, TokenKind.RIGHT_BRACE);

    private static final Set<String> OPERATOR_KEYWORDS = Set.of("and", "or", "not", "in", "is", "if", "else");

    private enum Block {
        FOR("for", SyntaxKind.STMT_FOR, SyntaxKind.FOR_START, SyntaxKind.FOR_END, false),
        IF("if", SyntaxKind.STMT_IF, SyntaxKind.IF_START, SyntaxKind.IF_END, false),
        ASSIGN("set", SyntaxKind.STMT_ASSIGN_BLOCK, SyntaxKind.ASSIGN_BLOCK_START, SyntaxKind.ASSIGN_BLOCK_END, false),
        CALL("call", SyntaxKind.STMT_CALL_BLOCK, SyntaxKind.CALL_BLOCK_START, SyntaxKind.CALL_BLOCK_END, false),
        FILTER("filter", SyntaxKind.STMT_FILTER_BLOCK, SyntaxKind.FILTER_BLOCK_START, SyntaxKind.FILTER_BLOCK_END,
                false),
        WITH("with", SyntaxKind.STMT_WITH, SyntaxKind.WITH_BLOCK_START, SyntaxKind.WITH_BLOCK_END, false),
        NAMED("block", SyntaxKind.STMT_BLOCK, SyntaxKind.NAMED_BLOCK_START, SyntaxKind.NAMED_BLOCK_END, false),
        MACRO("macro", SyntaxKind.STMT_MACRO, SyntaxKind.MACRO_BLOCK_START, SyntaxKind.MACRO_BLOCK_END, true),
        MATERIALIZATION("materialization", SyntaxKind.STMT_MATERIALIZATION,
                SyntaxKind.MATERIALIZATION_BLOCK_START, SyntaxKind.MATERIALIZATION_BLOCK_END, true),
        TEST("test", SyntaxKind.STMT_TEST, SyntaxKind.TEST_BLOCK_START, SyntaxKind.TEST_BLOCK_END, true),
        DOCS("docs", SyntaxKind.STMT_DOCS, SyntaxKind.DOCS_BLOCK_START, SyntaxKind.DOCS_BLOCK_END, true),
        SNAPSHOT("snapshot", SyntaxKind.STMT_SNAPSHOT, SyntaxKind.SNAPSHOT_BLOCK_START,
                SyntaxKind.SNAPSHOT_BLOCK_END, true);

        private final String keyword;
        private final SyntaxKind statement;
        private final SyntaxKind start;
        private final SyntaxKind end;
        // opening one of these closes every open block first
        private final boolean rootLevel;

        Block(String keyword, SyntaxKind statement, SyntaxKind start, SyntaxKind end, boolean rootLevel) {
            this.keyword = keyword;
            this.statement = statement;
            this.start = start;
            this.end = end;
            this.rootLevel = rootLevel;
        }

        String endKeyword() {
            return "end" + keyword;
        }

        static Block opening(String keyword) {
            for (Block block : values()) {
                if (block != ASSIGN && block.keyword.equals(keyword)) {
                    return block;
                }
            }
            return null;
        }

        static Block closing(String keyword) {
            for (Block block : values()) {
                if (block.endKeyword().equals(keyword)) {
                    return block;
                }
            }
            return null;
        }
    }

    private record OpenBlock(Block block, TextRange opener) {
    }

    private final String source;
    private final List<Token> tokens;
    private final BooleanSupplier cancelled;
    private final TreeBuilder builder = new TreeBuilder();
    private final List<ParseError> errors = new ArrayList<>();
    private final Deque<OpenBlock> blocks = new ArrayDeque<>();
    private int position;
    private int lastEnd;
    private int depth;

    private Parser(String source, List<Token> tokens, BooleanSupplier cancelled) {
        this.source = source;
        this.tokens = tokens;
        this.cancelled = cancelled;
    }

    public static ParseResult parse(String source) {
        return parse(source, Lexer.tokenize(source), () -> false);
    }

    public static ParseResult parse(String source, BooleanSupplier cancelled) {
        return parse(source, Lexer.tokenize(source), cancelled);
    }

    public static ParseResult parse(String source, List<Token> tokens) {
        return parse(source, tokens, () -> false);
    }

    /**
     * Parses an already lexed template.
     *
     * @param source    the text the tokens were produced from
     * @param tokens    the gapless token sequence covering {@code source}
     * @param cancelled polled between top-level elements; when it returns true the parse is abandoned
     * @throws CancellationException if {@code cancelled} reported true
     */
    public static ParseResult parse(String source, List<Token> tokens, BooleanSupplier cancelled) {
        return new Parser(source, tokens, cancelled).parseTemplate();
    }

    private ParseResult parseTemplate() {
        builder.startNode(SyntaxKind.TEMPLATE);
        while (position < tokens.size()) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("parse cancelled");
            }
            parseElement();
        }
        while (!blocks.isEmpty()) {
            abandon(blocks.pop());
        }
        builder.finishNode();
        return new ParseResult(builder.finish(source), errors);
    }

    private void parseElement() {
        Token token = tokens.get(position);
        switch (token.kind()) {
            case DATA -> {
                builder.startNode(SyntaxKind.EXPR_DATA);
                bump();
                builder.finishNode();
            }
            case VARIABLE_BEGIN -> parseVariable();
            case BLOCK_BEGIN -> parseStatement();
            case COMMENT_BEGIN -> parseComment();
            case RAW_BEGIN -> parseRaw();
            case WHITESPACE -> eatTrivia();
            default -> bumpError("unexpected " + describe(token) + " outside of a tag");
        }
    }

    private void parseVariable() {
        builder.startNode(SyntaxKind.VARIABLE);
        bump();
        parseTuple(false, true, null, false);
        expectTagEnd(TokenKind.VARIABLE_END);
        builder.finishNode();
    }

    private void parseComment() {
        int start = tokens.get(position).range().start();
        builder.startNode(SyntaxKind.COMMENT);
        bump();
        if (at(TokenKind.COMMENT_DATA)) {
            bump();
        }
        if (at(TokenKind.COMMENT_END)) {
            bump();
        } else {
            errors.add(ParseError.syntax(rangeFrom(start), "unterminated comment", TokenKind.COMMENT_END, null));
        }
        builder.finishNode();
    }

    private void parseRaw() {
        TextRange opener = tokens.get(position).range();
        builder.startNode(SyntaxKind.STMT_RAW);
        bump();
        if (at(TokenKind.DATA)) {
            bump();
        }
        if (at(TokenKind.RAW_END)) {
            bump();
            builder.finishNode();
        } else {
            builder.finishNode(SyntaxKind.ERROR);
            errors.add(ParseError.structural(opener, "'raw' block is never closed with 'endraw'"));
        }
    }

    // statements

    private void parseStatement() {
        Token keyword = nth(1);
        String name = keyword != null && keyword.kind() == TokenKind.NAME ? text(keyword) : "";
        if (name.isEmpty()) {
            parseUnknownStatement(ParseError.Category.SYNTAX, "expected a tag name after '{%'");
            return;
        }
        Block opened = Block.opening(name);
        if (opened != null) {
            openBlock(opened);
            return;
        }
        Block closed = Block.closing(name);
        if (closed != null) {
            closeBlock(closed);
            return;
        }
        switch (name) {
            case "set" -> parseSet();
            case "else", "elif" -> parseInterior(name);
            case "do" -> parseSimpleStatement(SyntaxKind.STMT_DO, () -> parseTuple(false, true, null, false));
            case "include" -> parseSimpleStatement(SyntaxKind.STMT_INCLUDE, this::parseIncludeBody);
            case "import" -> parseSimpleStatement(SyntaxKind.STMT_IMPORT, this::parseImportBody);
            case "from" -> parseSimpleStatement(SyntaxKind.STMT_FROM_IMPORT, this::parseFromImportBody);
            case "extends" -> parseSimpleStatement(SyntaxKind.STMT_EXTENDS, () -> parseExpression(true));
            default -> parseUnknownStatement(ParseError.Category.SYNTAX, "unknown tag '" + name + "'");
        }
    }

    private void openBlock(Block block) {
        if (block.rootLevel) {
            while (!blocks.isEmpty()) {
                abandon(blocks.pop());
            }
        }
        int start = tokens.get(position).range().start();
        builder.startNode(block.statement);
        builder.startNode(block.start);
        bump();
        bump();
        switch (block) {
            case FOR -> parseForHeader();
            case IF -> parseTuple(false, false, null, false);
            case CALL -> {
                if (at(TokenKind.LEFT_PAREN)) {
                    parseSignature();
                }
                parseExpression(true);
            }
            case FILTER -> parseFilterChain();
            case WITH -> parseWithAssignments();
            case NAMED -> {
                expectName("a block name");
                while (atKeyword("scoped") || atKeyword("required")) {
                    bump();
                }
            }
            case MACRO, TEST -> {
                expectName("a " + block.keyword + " name");
                parseSignature();
            }
            case MATERIALIZATION -> parseMaterializationHeader();
            case DOCS, SNAPSHOT -> expectName("a " + block.keyword + " name");
            default -> {
            }
        }
        expectTagEnd(TokenKind.BLOCK_END);
        builder.finishNode();
        blocks.push(new OpenBlock(block, rangeFrom(start)));
    }

    private void closeBlock(Block block) {
        OpenBlock owner = null;
        for (OpenBlock open : blocks) {
            if (open.block() == block) {
                owner = open;
                break;
            }
        }
        if (owner == null) {
            parseUnknownStatement(ParseError.Category.STRUCTURAL,
                    "'" + block.endKeyword() + "' has no matching '" + block.keyword + "'");
            return;
        }
        abandonUntil(owner);
        startNode(block.end);
        bump();
        bump();
        if (block == Block.NAMED && at(TokenKind.NAME)) {
            bump();
        }
        expectTagEnd(TokenKind.BLOCK_END);
        builder.finishNode();
        builder.finishNode();
        blocks.pop();
    }

    private void parseInterior(String keyword) {
        boolean elif = keyword.equals("elif");
        OpenBlock owner = null;
        for (OpenBlock open : blocks) {
            if (open.block() == Block.IF || (!elif && open.block() == Block.FOR)) {
                owner = open;
                break;
            }
        }
        if (owner == null) {
            parseUnknownStatement(ParseError.Category.STRUCTURAL,
                    "'" + keyword + "' outside of an 'if'" + (elif ? "" : " or 'for'") + " block");
            return;
        }
        abandonUntil(owner);
        SyntaxKind marker = owner.block() == Block.FOR
                ? SyntaxKind.FOR_ELSE
                : elif ? SyntaxKind.IF_ELIF : SyntaxKind.IF_ELSE;
        startNode(marker);
        bump();
        bump();
        if (elif) {
            parseTuple(false, false, null, false);
        }
        expectTagEnd(TokenKind.BLOCK_END);
        builder.finishNode();
    }

    /** {@code set} is a one-line assignment when followed by {@code =}, otherwise it opens a block. */
    private void parseSet() {
        int start = tokens.get(position).range().start();
        int checkpoint = builder.checkpoint();
        bump();
        bump();
        parseAssignTarget();
        if (at(TokenKind.ASSIGN)) {
            bump();
            parseTuple(false, true, null, false);
            expectTagEnd(TokenKind.BLOCK_END);
            builder.startNodeAt(checkpoint, SyntaxKind.STMT_ASSIGN);
            builder.finishNode();
            return;
        }
        while (at(TokenKind.PIPE)) {
            bump();
            parseFilterName();
        }
        expectTagEnd(TokenKind.BLOCK_END);
        builder.startNodeAt(checkpoint, SyntaxKind.ASSIGN_BLOCK_START);
        builder.finishNode();
        builder.startNodeAt(checkpoint, SyntaxKind.STMT_ASSIGN_BLOCK);
        blocks.push(new OpenBlock(Block.ASSIGN, rangeFrom(start)));
    }

    private void parseSimpleStatement(SyntaxKind kind, Runnable body) {
        builder.startNode(kind);
        bump();
        bump();
        body.run();
        expectTagEnd(TokenKind.BLOCK_END);
        builder.finishNode();
    }

    /** A tag that fits no statement: its tokens are kept as they are, under a {@code STMT_UNKNOWN} node. */
    private void parseUnknownStatement(ParseError.Category category, String message) {
        int start = tokens.get(position).range().start();
        builder.startNode(SyntaxKind.STMT_UNKNOWN);
        bump();
        while (!atBoundary()) {
            bump();
        }
        TextRange range = rangeFrom(start);
        if (at(TokenKind.BLOCK_END)) {
            bump();
            range = rangeFrom(start);
        }
        builder.finishNode();
        errors.add(new ParseError(range, message, category, null, null));
    }

    private void abandonUntil(OpenBlock owner) {
        while (blocks.peek() != owner) {
            abandon(blocks.pop());
        }
    }

    private void abandon(OpenBlock open) {
        builder.finishNode(SyntaxKind.ERROR);
        errors.add(ParseError.structural(open.opener(),
                "'" + open.block().keyword + "' block is never closed with '" + open.block().endKeyword() + "'"));
    }

    private void parseForHeader() {
        parseTuple(true, false, token -> isKeyword(token, "in"), false);
        if (!atKeyword("in")) {
            errorExpected(TokenKind.NAME, "expected 'in' after the loop target");
            return;
        }
        bumpAs(SyntaxKind.NAME_OPERATOR_IN);
        parseTuple(false, false, token -> isKeyword(token, "if") || isKeyword(token, "recursive"), false);
        if (atKeyword("if")) {
            bumpAs(SyntaxKind.NAME_OPERATOR_IF);
            parseExpression(true);
        }
        if (atKeyword("recursive")) {
            bump();
        }
    }

    private void parseAssignTarget() {
        Token next = nth(1);
        if (at(TokenKind.NAME) && next != null && next.kind() == TokenKind.DOT) {
            startNode(SyntaxKind.EXPR_NAMESPACE_REF);
            bump();
            bump();
            expectName("an attribute name");
            builder.finishNode();
        } else {
            parseTuple(true, false, null, false);
        }
    }

    private void parseFilterChain() {
        parseFilterName();
        while (at(TokenKind.PIPE)) {
            bump();
            parseFilterName();
        }
    }

    private void parseWithAssignments() {
        while (!atBoundary()) {
            startNode(SyntaxKind.WITH_ASSIGNMENT);
            parsePrimary();
            expect(TokenKind.ASSIGN, "expected '=' in a 'with' assignment");
            parseExpression(true);
            builder.finishNode();
            if (!at(TokenKind.COMMA)) {
                break;
            }
            bump();
        }
    }

    private void parseMaterializationHeader() {
        expectName("a materialization name");
        while (at(TokenKind.COMMA)) {
            bump();
            if (atKeyword("default")) {
                startNode(SyntaxKind.MATERIALIZATION_DEFAULT);
                bump();
                builder.finishNode();
            } else if (atKeyword("adapter")) {
                startNode(SyntaxKind.MATERIALIZATION_ADAPTER);
                bump();
                expect(TokenKind.ASSIGN, "expected '=' after 'adapter'");
                if (at(TokenKind.STRING_LITERAL)) {
                    parseStrings();
                } else {
                    errorExpected(TokenKind.STRING_LITERAL, "expected a string literal naming the adapter");
                }
                builder.finishNode();
            } else {
                errorExpected(null, "expected 'default' or 'adapter=...' in a materialization");
                return;
            }
        }
    }

    /** Argument list of a macro, test or call block; defaulted arguments must come last. */
    private void parseSignature() {
        startNode(SyntaxKind.SIGNATURE);
        if (!at(TokenKind.LEFT_PAREN)) {
            errorExpected(TokenKind.LEFT_PAREN, "expected '(' to start an argument list");
            builder.finishNode();
            return;
        }
        bump();
        boolean defaults = false;
        while (!at(TokenKind.RIGHT_PAREN) && !atBoundary()) {
            Token token = current();
            Token next = nth(1);
            if (token.kind() == TokenKind.NAME && next != null && next.kind() == TokenKind.ASSIGN) {
                startNode(SyntaxKind.SIGNATURE_DEFAULT_ARG);
                bump();
                bump();
                parseExpression(true);
                builder.finishNode();
                defaults = true;
            } else if (token.kind() == TokenKind.NAME) {
                startNode(SyntaxKind.SIGNATURE_ARG);
                bump();
                builder.finishNode();
                if (defaults) {
                    errors.add(ParseError.syntax(token.range(), "non-default argument follows a default argument"));
                }
            } else if (CLOSERS.contains(token.kind())) {
                break;
            } else {
                bumpError("expected an argument name, found " + describe(token));
            }
            if (!at(TokenKind.COMMA)) {
                break;
            }
            bump();
        }
        expectCloser(TokenKind.RIGHT_PAREN);
        builder.finishNode();
    }

    private void parseIncludeBody() {
        parseExpression(true);
        if (atKeyword("ignore") && isKeyword(nth(1), "missing")) {
            bump();
            bump();
        }
        parseContextModifier();
    }

    private void parseImportBody() {
        parseExpression(true);
        if (atKeyword("as")) {
            bump();
            expectName("an alias");
        } else {
            errorExpected(TokenKind.NAME, "expected 'as' after the imported template");
        }
        parseContextModifier();
    }

    private void parseFromImportBody() {
        parseExpression(true);
        if (!atKeyword("import")) {
            errorExpected(TokenKind.NAME, "expected 'import' after the source template");
            return;
        }
        bump();
        while (!atContextModifier()) {
            startNode(SyntaxKind.IMPORT_NAME);
            expectName("an imported name");
            if (atKeyword("as")) {
                bump();
                expectName("an alias");
            }
            builder.finishNode();
            if (!at(TokenKind.COMMA)) {
                break;
            }
            bump();
        }
        parseContextModifier();
    }

    private boolean atContextModifier() {
        return (atKeyword("with") || atKeyword("without")) && isKeyword(nth(1), "context");
    }

    private void parseContextModifier() {
        if (atContextModifier()) {
            bump();
            bump();
        }
    }

    // expressions

    /**
     * Parses a comma-separated sequence, producing an {@code EXPR_TUPLE} only when a comma is present.
     *
     * @param simplified      items are primaries only, as in assignment targets
     * @param withCondition   items may be conditional expressions
     * @param extraEnd        additional tokens that end the sequence, may be {@code null}
     * @param explicitParens  the sequence sits inside parentheses, so it may be empty
     */
    private void parseTuple(boolean simplified, boolean withCondition, Predicate<Token> extraEnd,
            boolean explicitParens) {
        int checkpoint = checkpoint();
        boolean tuple = false;
        int items = 0;
        while (true) {
            if (items > 0) {
                if (!at(TokenKind.COMMA)) {
                    break;
                }
                if (!tuple) {
                    builder.startNodeAt(checkpoint, SyntaxKind.EXPR_TUPLE);
                    tuple = true;
                }
                bump();
            }
            if (atBoundary() || at(TokenKind.RIGHT_PAREN) || (extraEnd != null && extraEnd.test(current()))) {
                break;
            }
            if (simplified) {
                parsePrimary();
            } else {
                parseExpression(withCondition);
            }
            items++;
        }
        if (tuple) {
            builder.finishNode();
        }
        if (items == 0 && !explicitParens) {
            errorExpected(null, "expected an expression");
        }
    }

    private void parseExpression(boolean withCondition) {
        if (!descend()) {
            return;
        }
        try {
            if (withCondition) {
                parseConditional();
            } else {
                parseOr();
            }
        } finally {
            depth--;
        }
    }

    private void parseConditional() {
        int checkpoint = checkpoint();
        parseOr();
        while (atKeyword("if")) {
            builder.startNodeAt(checkpoint, SyntaxKind.EXPR_TERNARY);
            bumpAs(SyntaxKind.NAME_OPERATOR_IF);
            parseOr();
            if (atKeyword("else")) {
                bumpAs(SyntaxKind.NAME_OPERATOR_ELSE);
                parseExpression(true);
            }
            builder.finishNode();
        }
    }

    private void parseOr() {
        parseBinary(this::parseAnd, token -> isKeyword(token, "or") ? SyntaxKind.EXPR_OR : null);
    }

    private void parseAnd() {
        parseBinary(this::parseNot, token -> isKeyword(token, "and") ? SyntaxKind.EXPR_AND : null);
    }

    private void parseNot() {
        if (!atKeyword("not")) {
            parseCompare();
            return;
        }
        if (!descend()) {
            return;
        }
        try {
            startNode(SyntaxKind.EXPR_NOT);
            bumpAs(SyntaxKind.NAME_OPERATOR_NOT);
            parseNot();
            builder.finishNode();
        } finally {
            depth--;
        }
    }

    /** Chained comparisons: one {@code EXPR_COMPARE} holding the left side and an {@code OPERAND} per step. */
    private void parseCompare() {
        int checkpoint = checkpoint();
        parseAdditive();
        boolean compare = false;
        while (true) {
            Token token = current();
            boolean notIn = isKeyword(token, "not") && isKeyword(nth(1), "in");
            if (token == null || !(token.kind().isComparison() || isKeyword(token, "in") || notIn)) {
                break;
            }
            if (!compare) {
                builder.startNodeAt(checkpoint, SyntaxKind.EXPR_COMPARE);
                compare = true;
            }
            startNode(SyntaxKind.OPERAND);
            if (notIn) {
                startNode(SyntaxKind.NAME_OPERATOR_NOT_IN);
                bumpAs(SyntaxKind.NAME_OPERATOR_NOT);
                bumpAs(SyntaxKind.NAME_OPERATOR_IN);
                builder.finishNode();
            } else if (token.kind() == TokenKind.NAME) {
                bumpAs(SyntaxKind.NAME_OPERATOR_IN);
            } else {
                bump();
            }
            parseAdditive();
            builder.finishNode();
        }
        if (compare) {
            builder.finishNode();
        }
    }

    private void parseAdditive() {
        parseBinary(this::parseConcat, token -> {
            if (token == null) {
                return null;
            }
            return switch (token.kind()) {
                case ADD -> SyntaxKind.EXPR_ADD;
                case SUBTRACT -> SyntaxKind.EXPR_SUBTRACT;
                default -> null;
            };
        });
    }

    private void parseConcat() {
        parseBinary(this::parseMultiplicative,
                token -> token != null && token.kind() == TokenKind.TILDE ? SyntaxKind.EXPR_CONCAT : null);
    }

    private void parseMultiplicative() {
        parseBinary(this::parseUnary, token -> {
            if (token == null) {
                return null;
            }
            return switch (token.kind()) {
                case MULTIPLY -> SyntaxKind.EXPR_MULTIPLY;
                case DIV -> SyntaxKind.EXPR_DIVIDE;
                case FLOOR_DIV -> SyntaxKind.EXPR_FLOOR_DIVIDE;
                case MODULO -> SyntaxKind.EXPR_MODULO;
                default -> null;
            };
        });
    }

    private void parseBinary(Runnable operand, Function<Token, SyntaxKind> nodeKind) {
        int checkpoint = checkpoint();
        operand.run();
        SyntaxKind kind;
        while ((kind = nodeKind.apply(current())) != null) {
            builder.startNodeAt(checkpoint, kind);
            Token operator = current();
            if (operator.kind() == TokenKind.NAME) {
                bumpAs(KindTable.nameOperator(text(operator)).orElse(SyntaxKind.NAME));
            } else {
                bump();
            }
            operand.run();
            builder.finishNode();
        }
    }

    private void parseUnary() {
        if (!descend()) {
            return;
        }
        try {
            if (at(TokenKind.SUBTRACT) || at(TokenKind.ADD)) {
                startNode(at(TokenKind.SUBTRACT) ? SyntaxKind.EXPR_NEGATIVE : SyntaxKind.EXPR_POSITIVE);
                bump();
                parseUnary();
                builder.finishNode();
            } else {
                parsePower();
            }
        } finally {
            depth--;
        }
    }

    private void parsePower() {
        int checkpoint = checkpoint();
        parsePrimary();
        parsePostfix(checkpoint, true);
        if (at(TokenKind.POWER)) {
            builder.startNodeAt(checkpoint, SyntaxKind.EXPR_POWER);
            bump();
            parseUnary();
            builder.finishNode();
        }
    }

    private void parsePrimary() {
        Token token = current();
        if (token == null || BOUNDARIES.contains(token.kind()) || CLOSERS.contains(token.kind())) {
            errorExpected(null, "expected an expression");
            return;
        }
        switch (token.kind()) {
            case NAME -> {
                String name = text(token);
                SyntaxKind kind = switch (name) {
                    case "true", "false", "True", "False" -> SyntaxKind.EXPR_CONSTANT_BOOL;
                    case "none", "None" -> SyntaxKind.EXPR_CONSTANT_NONE;
                    default -> SyntaxKind.EXPR_NAME;
                };
                wrapToken(kind);
            }
            case STRING_LITERAL -> parseStrings();
            case INTEGER_LITERAL -> wrapToken(SyntaxKind.EXPR_CONSTANT_INTEGER);
            case FLOAT_LITERAL -> wrapToken(SyntaxKind.EXPR_CONSTANT_FLOAT);
            case LEFT_PAREN -> {
                startNode(SyntaxKind.EXPR_WRAPPED);
                bump();
                if (!at(TokenKind.RIGHT_PAREN)) {
                    parseTuple(false, true, null, true);
                }
                expectCloser(TokenKind.RIGHT_PAREN);
                builder.finishNode();
            }
            case LEFT_BRACKET -> parseList();
            case LEFT_BRACE -> parseDict();
            default -> bumpError("expected an expression, found " + describe(token));
        }
    }

    private void wrapToken(SyntaxKind kind) {
        startNode(kind);
        bump();
        builder.finishNode();
    }

    /** Adjacent string literals form a single constant. */
    private void parseStrings() {
        startNode(SyntaxKind.EXPR_CONSTANT_STRING);
        do {
            bump();
        } while (at(TokenKind.STRING_LITERAL));
        builder.finishNode();
    }

    private void parseList() {
        startNode(SyntaxKind.EXPR_LIST);
        bump();
        while (!at(TokenKind.RIGHT_BRACKET) && !atBoundary()) {
            parseExpression(true);
            if (!at(TokenKind.COMMA)) {
                break;
            }
            bump();
        }
        expectCloser(TokenKind.RIGHT_BRACKET);
        builder.finishNode();
    }

    private void parseDict() {
        startNode(SyntaxKind.EXPR_DICT);
        bump();
        while (!at(TokenKind.RIGHT_BRACE) && !atBoundary()) {
            startNode(SyntaxKind.PAIR);
            parseExpression(true);
            expect(TokenKind.COLON, "expected ':' after a dictionary key");
            parseExpression(true);
            builder.finishNode();
            if (!at(TokenKind.COMMA)) {
                break;
            }
            bump();
        }
        expectCloser(TokenKind.RIGHT_BRACE);
        builder.finishNode();
    }

    private void parsePostfix(int checkpoint, boolean withFilters) {
        while (true) {
            Token token = current();
            if (token == null) {
                return;
            }
            switch (token.kind()) {
                case DOT -> parseAttribute(checkpoint);
                case LEFT_BRACKET -> parseSubscript(checkpoint);
                case LEFT_PAREN -> {
                    builder.startNodeAt(checkpoint, SyntaxKind.EXPR_CALL);
                    parseCallArguments();
                    builder.finishNode();
                }
                case PIPE -> {
                    if (!withFilters) {
                        return;
                    }
                    builder.startNodeAt(checkpoint, SyntaxKind.EXPR_FILTER);
                    bump();
                    parseFilterName();
                    builder.finishNode();
                }
                case NAME -> {
                    if (!withFilters || !isKeyword(token, "is")) {
                        return;
                    }
                    parseTest(checkpoint);
                }
                default -> {
                    return;
                }
            }
        }
    }

    /** {@code .name} reads an attribute, {@code .0} an item. */
    private void parseAttribute(int checkpoint) {
        Token next = nth(1);
        boolean item = next != null && next.kind() == TokenKind.INTEGER_LITERAL;
        builder.startNodeAt(checkpoint, item ? SyntaxKind.EXPR_GET_ITEM : SyntaxKind.EXPR_GET_ATTR);
        bump();
        if (at(TokenKind.NAME) || at(TokenKind.INTEGER_LITERAL)) {
            bump();
        } else {
            errorExpected(TokenKind.NAME, "expected an attribute name after '.'");
        }
        builder.finishNode();
    }

    private void parseSubscript(int checkpoint) {
        builder.startNodeAt(checkpoint, SyntaxKind.EXPR_GET_ITEM);
        bump();
        startNode(SyntaxKind.SUBSCRIPT);
        int tupleCheckpoint = checkpoint();
        boolean tuple = false;
        parseSubscribed();
        while (at(TokenKind.COMMA)) {
            if (!tuple) {
                builder.startNodeAt(tupleCheckpoint, SyntaxKind.EXPR_TUPLE);
                tuple = true;
            }
            bump();
            if (at(TokenKind.RIGHT_BRACKET)) {
                break;
            }
            parseSubscribed();
        }
        if (tuple) {
            builder.finishNode();
        }
        builder.finishNode();
        expectCloser(TokenKind.RIGHT_BRACKET);
        builder.finishNode();
    }

    /** One subscript: an expression or a {@code start:stop:step} slice with every part optional. */
    private void parseSubscribed() {
        int checkpoint = checkpoint();
        if (!at(TokenKind.COLON)) {
            parseExpression(true);
            if (!at(TokenKind.COLON)) {
                return;
            }
        }
        builder.startNodeAt(checkpoint, SyntaxKind.EXPR_SLICE);
        bump();
        if (!at(TokenKind.COLON) && !at(TokenKind.COMMA) && !at(TokenKind.RIGHT_BRACKET) && !atBoundary()) {
            parseExpression(true);
        }
        if (at(TokenKind.COLON)) {
            bump();
            if (!at(TokenKind.COMMA) && !at(TokenKind.RIGHT_BRACKET) && !atBoundary()) {
                parseExpression(true);
            }
        }
        builder.finishNode();
    }

    /**
     * Call arguments in Jinja's order: positional, then keyword, then {@code *args}, then {@code **kwargs}.
     * Arguments out of order are still parsed and reported.
     */
    private void parseCallArguments() {
        startNode(SyntaxKind.CALL_ARGUMENTS);
        bump();
        boolean keywords = false;
        boolean dynamicArgs = false;
        boolean dynamicKwargs = false;
        while (!at(TokenKind.RIGHT_PAREN) && !atBoundary()) {
            Token first = current();
            Token next = nth(1);
            boolean valid;
            if (first.kind() == TokenKind.POWER) {
                startNode(SyntaxKind.CALL_DYNAMIC_KWARGS);
                bump();
                parseExpression(true);
                valid = !dynamicKwargs;
                dynamicKwargs = true;
            } else if (first.kind() == TokenKind.MULTIPLY) {
                startNode(SyntaxKind.CALL_DYNAMIC_ARGS);
                bump();
                parseExpression(true);
                valid = !dynamicArgs && !dynamicKwargs;
                dynamicArgs = true;
            } else if (first.kind() == TokenKind.NAME && next != null && next.kind() == TokenKind.ASSIGN) {
                startNode(SyntaxKind.CALL_STATIC_KWARG);
                bump();
                bump();
                parseExpression(true);
                valid = !dynamicKwargs;
                keywords = true;
            } else {
                startNode(SyntaxKind.CALL_STATIC_ARG);
                parseExpression(true);
                valid = !keywords && !dynamicArgs && !dynamicKwargs;
            }
            builder.finishNode();
            if (!valid) {
                errors.add(ParseError.syntax(rangeFrom(first.range().start()),
                        "argument out of order: positional, keyword, *args, **kwargs"));
            }
            if (!at(TokenKind.COMMA)) {
                break;
            }
            bump();
        }
        expectCloser(TokenKind.RIGHT_PAREN);
        builder.finishNode();
    }

    private void parseTest(int checkpoint) {
        builder.startNodeAt(checkpoint, SyntaxKind.EXPR_TEST);
        bumpAs(SyntaxKind.NAME_OPERATOR_IS);
        if (atKeyword("not")) {
            bumpAs(SyntaxKind.NAME_OPERATOR_NOT);
        }
        parseNestedName();
        if (at(TokenKind.LEFT_PAREN)) {
            parseCallArguments();
        } else if (startsTestArgument()) {
            startNode(SyntaxKind.TEST_ARGUMENTS);
            int argument = checkpoint();
            parsePrimary();
            parsePostfix(argument, false);
            builder.finishNode();
        }
        builder.finishNode();
    }

    private boolean startsTestArgument() {
        Token token = current();
        if (token == null) {
            return false;
        }
        return switch (token.kind()) {
            case NAME -> !OPERATOR_KEYWORDS.contains(text(token));
            case STRING_LITERAL, INTEGER_LITERAL, FLOAT_LITERAL, LEFT_BRACKET, LEFT_BRACE -> true;
            default -> false;
        };
    }

    private void parseFilterName() {
        startNode(SyntaxKind.EXPR_FILTER_NAME);
        parseNestedName();
        if (at(TokenKind.LEFT_PAREN)) {
            parseCallArguments();
        }
        builder.finishNode();
    }

    /** A name, or dotted names grouped under {@code EXPR_NESTED_NAME}. */
    private void parseNestedName() {
        int checkpoint = checkpoint();
        if (!at(TokenKind.NAME)) {
            errorExpected(TokenKind.NAME, "expected a name");
            return;
        }
        bump();
        if (!at(TokenKind.DOT)) {
            return;
        }
        builder.startNodeAt(checkpoint, SyntaxKind.EXPR_NESTED_NAME);
        while (at(TokenKind.DOT)) {
            bump();
            if (!at(TokenKind.NAME)) {
                errorExpected(TokenKind.NAME, "expected a name after '.'");
                break;
            }
            bump();
        }
        builder.finishNode();
    }

    private boolean descend() {
        if (depth < MAX_EXPRESSION_DEPTH) {
            depth++;
            return true;
        }
        errorExpected(null, "expression is nested too deeply");
        skipUnexpected(token -> false, null);
        return false;
    }

    // tag ends and recovery

    private void expectTagEnd(TokenKind end) {
        skipUnexpected(token -> false, "unexpected tokens before '" + (end == TokenKind.BLOCK_END ? "%}" : "}}") + "'");
        if (at(end)) {
            bump();
        } else {
            errorExpected(end, "expected '" + (end == TokenKind.BLOCK_END ? "%}" : "}}") + "'");
        }
    }

    /** Lifts stray tokens up to a closing bracket, then consumes {@code closer} if it is the one found. */
    private void expectCloser(TokenKind closer) {
        skipUnexpected(token -> CLOSERS.contains(token.kind()), "unexpected tokens before '" + closer.symbol() + "'");
        expect(closer, "expected '" + closer.symbol() + "'");
    }

    private void expect(TokenKind kind, String message) {
        if (at(kind)) {
            bump();
        } else {
            errorExpected(kind, message);
        }
    }

    private void expectName(String what) {
        expect(TokenKind.NAME, "expected " + what);
    }

    /**
     * Lifts tokens as {@code ERROR} leaves until a boundary or a token matching {@code stop}. One syntax
     * error covers the whole run; lexer errors inside it are already reported on their own.
     */
    private void skipUnexpected(Predicate<Token> stop, String message) {
        int start = -1;
        boolean unexpected = false;
        while (!atBoundary() && !stop.test(current())) {
            Token token = current();
            if (start < 0) {
                start = token.range().start();
            }
            unexpected |= token.kind() != TokenKind.ERROR;
            bumpAs(SyntaxKind.ERROR);
        }
        if (unexpected && message != null) {
            errors.add(ParseError.syntax(rangeFrom(start), message));
        }
    }

    private void errorExpected(TokenKind expected, String message) {
        Token found = current();
        TextRange range = found != null ? found.range() : TextRange.empty(lastEnd);
        errors.add(ParseError.syntax(range, message, expected, found != null ? found.kind() : null));
    }

    // token access

    private void startNode(SyntaxKind kind) {
        eatTrivia();
        builder.startNode(kind);
    }

    private int checkpoint() {
        eatTrivia();
        return builder.checkpoint();
    }

    private void eatTrivia() {
        while (position < tokens.size() && tokens.get(position).kind() == TokenKind.WHITESPACE) {
            Token token = tokens.get(position++);
            builder.token(token, SyntaxKind.WHITESPACE);
        }
    }

    private void bump() {
        Token token = current();
        if (token != null) {
            bumpAs(KindTable.leaf(token.kind()));
        }
    }

    /** Adds the next token under {@code kind}; lexer error tokens always stay {@code ERROR}. */
    private void bumpAs(SyntaxKind kind) {
        eatTrivia();
        if (position >= tokens.size()) {
            return;
        }
        Token token = tokens.get(position++);
        if (token.kind() == TokenKind.ERROR) {
            errors.add(ParseError.lexical(token.range(), lexicalMessage(token)));
            builder.token(token, SyntaxKind.ERROR);
        } else {
            builder.token(token, kind);
        }
        lastEnd = token.range().end();
    }

    private void bumpError(String message) {
        Token token = current();
        if (token == null) {
            return;
        }
        if (token.kind() != TokenKind.ERROR) {
            errors.add(ParseError.syntax(token.range(), message, null, token.kind()));
        }
        bumpAs(SyntaxKind.ERROR);
    }

    private String lexicalMessage(Token token) {
        String text = text(token);
        if (text.equals("'") || text.equals("\"")) {
            return "unterminated string literal";
        }
        return "unexpected character '" + text + "'";
    }

    private int skipWhitespace(int from) {
        int index = from;
        while (index < tokens.size() && tokens.get(index).kind() == TokenKind.WHITESPACE) {
            index++;
        }
        return index;
    }

    /** The next significant token, or {@code null} at the end of input. */
    private Token current() {
        return nth(0);
    }

    private Token nth(int n) {
        int index = skipWhitespace(position);
        for (int i = 0; i < n && index < tokens.size(); i++) {
            index = skipWhitespace(index + 1);
        }
        return index < tokens.size() ? tokens.get(index) : null;
    }

    private boolean at(TokenKind kind) {
        Token token = current();
        return token != null && token.kind() == kind;
    }

    private boolean atKeyword(String keyword) {
        return isKeyword(current(), keyword);
    }

    private boolean atBoundary() {
        Token token = current();
        return token == null || BOUNDARIES.contains(token.kind());
    }

    private boolean isKeyword(Token token, String keyword) {
        return token != null
                && token.kind() == TokenKind.NAME
                && token.range().length() == keyword.length()
                && source.startsWith(keyword, token.range().start());
    }

    private String text(Token token) {
        return token.text(source);
    }

    private String describe(Token token) {
        if (token == null) {
            return "end of input";
        }
        if (token.kind().symbol() != null) {
            return "'" + token.kind().symbol() + "'";
        }
        if (token.kind() == TokenKind.NAME) {
            return "name '" + text(token) + "'";
        }
        return token.kind().name().toLowerCase().replace('_', ' ');
    }

    private TextRange rangeFrom(int start) {
        return new TextRange(start, Math.max(start, lastEnd));
    }
}
