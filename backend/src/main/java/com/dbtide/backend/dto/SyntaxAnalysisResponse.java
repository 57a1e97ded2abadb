package com.dbtide.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyntaxAnalysisResponse(
        boolean success,
        ContentType contentType,
        List<SyntaxToken> tokens,
        List<Diagnostic> diagnostics,
        String error,
        long analysisTimeMs) {

    public static SyntaxAnalysisResponse success(ContentType contentType, List<SyntaxToken> tokens,
            List<Diagnostic> diagnostics, long analysisTimeMs) {
        return new SyntaxAnalysisResponse(true, contentType, tokens, diagnostics, null, analysisTimeMs);
    }

    public static SyntaxAnalysisResponse error(String error, long analysisTimeMs) {
        return new SyntaxAnalysisResponse(false, null, List.of(), List.of(), error, analysisTimeMs);
    }
}
