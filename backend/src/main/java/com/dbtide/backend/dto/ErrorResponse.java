package com.dbtide.backend.dto;

public record ErrorResponse(String error, int status) {
}
