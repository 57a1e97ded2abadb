package com.dbtide.backend.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** @param documentKey identifies the document across requests so a timed-out dump can fall back to the last one */
public record TreeRequest(
        @NotNull(message = "Source code cannot be null")
        @Size(max = 1_000_000, message = "Source code cannot exceed 1,000,000 characters")
        String sourceCode,
        String documentKey) {
}
