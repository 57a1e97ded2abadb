package com.dbtide.backend.syntax;

import java.util.List;

/** A complete tree together with every error met while building it. */
public record ParseResult(SyntaxTree tree, List<ParseError> errors) {

    public ParseResult {
        errors = List.copyOf(errors);
    }

    public SyntaxElement root() {
        return tree.root();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<ParseError> errors(ParseError.Category category) {
        return errors.stream().filter(error -> error.category() == category).toList();
    }
}
