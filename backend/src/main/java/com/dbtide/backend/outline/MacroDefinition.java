package com.dbtide.backend.outline;

import com.dbtide.backend.syntax.TextRange;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A {@code macro} or generic {@code test} definition.
 *
 * @param nameRange where the name is written, used as the jump target
 * @param range     the whole block, closer included when there is one
 */
public record MacroDefinition(String name, TextRange nameRange, TextRange range, List<MacroArgument> arguments) {

    public MacroDefinition {
        arguments = List.copyOf(arguments);
    }

    public List<MacroArgument> requiredArguments() {
        return arguments.stream().filter(argument -> !argument.hasDefault()).toList();
    }

    public String signature() {
        return arguments.stream().map(MacroArgument::toString).collect(Collectors.joining(", ", name + "(", ")"));
    }
}
