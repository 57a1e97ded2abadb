package com.dbtide.backend.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record SyntaxAnalysisRequest(
        @NotNull(message = "Source code cannot be null")
        @Size(max = 1_000_000, message = "Source code cannot exceed 1,000,000 characters")
        String sourceCode,
        ContentType contentType) {

    public ContentType contentTypeOrDefault() {
        return contentType != null ? contentType : ContentType.TEMPLATED_SQL;
    }
}
