package com.dbtide.backend.dto;

import java.util.List;

public record DocumentStatus(
        String uri,
        int version,
        ContentType contentType,
        List<Diagnostic> diagnostics,
        long parseTimeMs) {
}
