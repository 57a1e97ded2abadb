package com.dbtide.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record DocumentUpdateRequest(
        @NotBlank(message = "Document uri cannot be blank")
        String uri,
        @PositiveOrZero(message = "Version must not be negative")
        int version,
        @NotNull(message = "Document text cannot be null")
        String text,
        ContentType contentType) {

    public ContentType contentTypeOrDefault() {
        return contentType != null ? contentType : ContentType.fromUri(uri);
    }
}
