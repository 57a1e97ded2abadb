package com.dbtide.backend.dto;

public record SyntaxToken(
        int startLine,
        int startColumn,
        int endLine,
        int endColumn,
        String tokenType,
        int kindId,
        String value,
        boolean trivia) {
}
