package com.dbtide.backend.service;

import com.dbtide.backend.dto.ContentType;
import com.dbtide.backend.dto.DocumentStatus;
import com.dbtide.backend.outline.TemplateOutline;
import com.dbtide.backend.syntax.ParseResult;
import com.dbtide.backend.text.PositionFinder;

/** One parsed version of an open document. Immutable, so readers never need a lock. */
public record DocumentSnapshot(
        String uri,
        int version,
        ContentType contentType,
        String text,
        ParseResult result,
        TemplateOutline outline,
        PositionFinder positions,
        long parseTimeMs) {

    static DocumentSnapshot of(String uri, int version, ContentType contentType, String text, ParseResult result,
            long parseTimeMs) {
        return new DocumentSnapshot(uri, version, contentType, text, result, TemplateOutline.of(result.tree()),
                new PositionFinder(text), parseTimeMs);
    }

    public DocumentStatus status() {
        return new DocumentStatus(uri, version, contentType, SyntaxMapping.diagnostics(result.errors(), positions),
                parseTimeMs);
    }
}
