package com.dbtide.backend.service;

import com.dbtide.backend.outline.MacroDefinition;
import com.dbtide.backend.text.PositionFinder;

import java.nio.file.Path;

/**
 * A macro defined in a project file.
 *
 * @param packageName installed package the macro comes from, {@code null} for the root project
 * @param positions   line index of the defining file
 */
public record ProjectMacro(String packageName, Path path, MacroDefinition definition, PositionFinder positions) {

    public String name() {
        return definition.name();
    }

    /** {@code package.macro} for package macros, the plain name otherwise. */
    public String qualifiedName() {
        return packageName != null ? packageName + "." + definition.name() : definition.name();
    }
}
