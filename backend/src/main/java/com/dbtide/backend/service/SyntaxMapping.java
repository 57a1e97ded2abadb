package com.dbtide.backend.service;

import com.dbtide.backend.dto.Diagnostic;
import com.dbtide.backend.dto.SyntaxToken;
import com.dbtide.backend.syntax.KindTable;
import com.dbtide.backend.syntax.ParseError;
import com.dbtide.backend.syntax.TextRange;
import com.dbtide.backend.syntax.Token;
import com.dbtide.backend.text.Position;
import com.dbtide.backend.text.PositionFinder;

import java.util.List;

/** Conversions from syntax types to the line/column based DTOs. */
final class SyntaxMapping {

    private SyntaxMapping() {
    }

    static SyntaxToken token(Token token, String source, PositionFinder positions) {
        Position start = positions.position(token.range().start());
        Position end = positions.position(token.range().end());
        return new SyntaxToken(
                start.line(),
                start.character(),
                end.line(),
                end.character(),
                token.kind().name(),
                KindTable.id(token.kind()),
                token.text(source),
                token.isTrivia());
    }

    static List<Diagnostic> diagnostics(List<ParseError> errors, PositionFinder positions) {
        return errors.stream().map(error -> diagnostic(error, positions)).toList();
    }

    static Diagnostic diagnostic(ParseError error, PositionFinder positions) {
        TextRange range = error.range();
        Position start = positions.position(range.start());
        Position end = positions.position(range.end());
        return new Diagnostic(
                start.line(),
                start.character(),
                end.line(),
                end.character(),
                error.category().name(),
                error.message(),
                error.expected() != null ? error.expected().name() : null,
                error.found() != null ? error.found().name() : null);
    }
}
