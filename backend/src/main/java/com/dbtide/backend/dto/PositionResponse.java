package com.dbtide.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PositionResponse(
        boolean found,
        SyntaxToken token,
        String enclosingBlock,
        List<String> ancestors) {

    public static PositionResponse of(SyntaxToken token, String enclosingBlock, List<String> ancestors) {
        return new PositionResponse(true, token, enclosingBlock, ancestors);
    }

    public static PositionResponse notFound() {
        return new PositionResponse(false, null, null, List.of());
    }
}
