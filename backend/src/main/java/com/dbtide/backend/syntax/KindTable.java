package com.dbtide.backend.syntax;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide, immutable mapping between symbol text, kinds and their numeric ids.
 *
 * <p>Ids are the declaration order of {@link TokenKind} and {@link SyntaxKind}; each enum forms its own
 * contiguous id space {@code [0, count)} and carries its own {@code ERROR} member.
 */
public final class KindTable {

    private static final Map<String, TokenKind> SYMBOLS;
    private static final Map<String, SyntaxKind> NAME_OPERATORS;
    private static final SyntaxKind[] LEAVES;
    private static final TokenKind[] TOKEN_KINDS = TokenKind.values();
    private static final SyntaxKind[] SYNTAX_KINDS = SyntaxKind.values();
    private static final int MAX_SYMBOL_LENGTH;

    static {
        Map<String, TokenKind> symbols = new HashMap<>();
        int maxLength = 0;
        for (TokenKind kind : TOKEN_KINDS) {
            if (kind.symbol() != null) {
                symbols.put(kind.symbol(), kind);
                maxLength = Math.max(maxLength, kind.symbol().length());
            }
        }
        SYMBOLS = Collections.unmodifiableMap(symbols);
        MAX_SYMBOL_LENGTH = maxLength;

        LEAVES = new SyntaxKind[TOKEN_KINDS.length];
        for (TokenKind kind : TOKEN_KINDS) {
            SyntaxKind leaf = SyntaxKind.valueOf(kind.name());
            if (leaf.ordinal() != kind.ordinal()) {
                throw new IllegalStateException("leaf kind " + leaf + " is out of order with its token kind");
            }
            LEAVES[kind.ordinal()] = leaf;
        }

        Map<String, SyntaxKind> nameOperators = new HashMap<>();
        nameOperators.put("or", SyntaxKind.NAME_OPERATOR_OR);
        nameOperators.put("and", SyntaxKind.NAME_OPERATOR_AND);
        nameOperators.put("not", SyntaxKind.NAME_OPERATOR_NOT);
        nameOperators.put("if", SyntaxKind.NAME_OPERATOR_IF);
        nameOperators.put("else", SyntaxKind.NAME_OPERATOR_ELSE);
        nameOperators.put("in", SyntaxKind.NAME_OPERATOR_IN);
        nameOperators.put("is", SyntaxKind.NAME_OPERATOR_IS);
        nameOperators.put("not in", SyntaxKind.NAME_OPERATOR_NOT_IN);
        NAME_OPERATORS = Collections.unmodifiableMap(nameOperators);
    }

    private KindTable() {
    }

    /** Exact-match lookup of an operator or comparison; anything else is {@link TokenKind#ERROR}. */
    public static TokenKind symbol(String text) {
        return SYMBOLS.getOrDefault(text, TokenKind.ERROR);
    }

    public static int maxSymbolLength() {
        return MAX_SYMBOL_LENGTH;
    }

    public static Optional<SyntaxKind> nameOperator(String keyword) {
        return Optional.ofNullable(NAME_OPERATORS.get(keyword));
    }

    public static SyntaxKind leaf(TokenKind kind) {
        return LEAVES[kind.ordinal()];
    }

    public static int id(TokenKind kind) {
        return kind.ordinal();
    }

    public static int id(SyntaxKind kind) {
        return kind.ordinal();
    }

    public static TokenKind tokenKind(int id) {
        return id >= 0 && id < TOKEN_KINDS.length ? TOKEN_KINDS[id] : TokenKind.ERROR;
    }

    public static SyntaxKind syntaxKind(int id) {
        return id >= 0 && id < SYNTAX_KINDS.length ? SYNTAX_KINDS[id] : SyntaxKind.ERROR;
    }

    public static int tokenKindCount() {
        return TOKEN_KINDS.length;
    }

    public static int syntaxKindCount() {
        return SYNTAX_KINDS.length;
    }

    /** Symbol text to id for every operator and comparison, in id order. */
    public static Map<String, Integer> symbolIds() {
        Map<String, Integer> ids = new LinkedHashMap<>();
        for (TokenKind kind : TOKEN_KINDS) {
            if (kind.symbol() != null) {
                ids.put(kind.symbol(), id(kind));
            }
        }
        return Collections.unmodifiableMap(ids);
    }
}
