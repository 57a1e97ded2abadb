package com.dbtide.backend.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record PositionRequest(
        @NotNull(message = "Source code cannot be null")
        @Size(max = 1_000_000, message = "Source code cannot exceed 1,000,000 characters")
        String sourceCode,
        @PositiveOrZero(message = "Line must not be negative")
        int line,
        @PositiveOrZero(message = "Character must not be negative")
        int character) {
}
