package com.dbtide.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Diagnostic(
        int startLine,
        int startColumn,
        int endLine,
        int endColumn,
        String category,
        String message,
        String expected,
        String found) {
}
