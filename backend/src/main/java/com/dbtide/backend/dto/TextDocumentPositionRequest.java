package com.dbtide.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record TextDocumentPositionRequest(
        @NotBlank(message = "Document uri cannot be blank")
        String uri,
        @PositiveOrZero(message = "Line must not be negative")
        int line,
        @PositiveOrZero(message = "Character must not be negative")
        int character) {
}
