package com.dbtide.backend.dto;

import java.util.List;

public record CompletionResponse(List<CompletionItem> items) {

    public static CompletionResponse empty() {
        return new CompletionResponse(List.of());
    }
}
