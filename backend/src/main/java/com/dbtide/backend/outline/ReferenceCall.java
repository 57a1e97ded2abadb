package com.dbtide.backend.outline;

import com.dbtide.backend.syntax.TextRange;

import java.util.List;

/**
 * A {@code ref(...)} or {@code source(...)} call whose positional arguments are string constants.
 *
 * @param arguments the unquoted string arguments, in order
 */
public record ReferenceCall(String function, List<String> arguments, TextRange range) {

    public ReferenceCall {
        arguments = List.copyOf(arguments);
    }

    /** The model name of a {@code ref}: its last argument, the first one being an optional package. */
    public String target() {
        return arguments.isEmpty() ? "" : arguments.get(arguments.size() - 1);
    }
}
