package com.dbtide.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DefinitionResponse(
        boolean found,
        String uri,
        Integer startLine,
        Integer startColumn,
        Integer endLine,
        Integer endColumn) {

    public static DefinitionResponse at(String uri, int startLine, int startColumn, int endLine, int endColumn) {
        return new DefinitionResponse(true, uri, startLine, startColumn, endLine, endColumn);
    }

    public static DefinitionResponse none() {
        return new DefinitionResponse(false, null, null, null, null, null);
    }
}
