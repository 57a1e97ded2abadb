package com.dbtide.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompletionItem(
        String label,
        CompletionKind kind,
        String detail,
        String insertText) {

    public enum CompletionKind {
        MODEL,
        MACRO,
        BUILTIN,
        KEYWORD
    }
}
