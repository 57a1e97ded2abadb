package com.dbtide.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HoverResponse(boolean found, String contents) {

    public static HoverResponse of(String contents) {
        return new HoverResponse(true, contents);
    }

    public static HoverResponse none() {
        return new HoverResponse(false, null);
    }
}
