package com.dbtide.backend.syntax;

/** A lexed token: its kind and where it sits in the source. */
public record Token(TokenKind kind, TextRange range) {

    public Token(TokenKind kind, int start, int end) {
        this(kind, new TextRange(start, end));
    }

    public boolean isTrivia() {
        return kind.isTrivia();
    }

    public String text(CharSequence source) {
        return source.subSequence(range.start(), range.end()).toString();
    }
}
