package com.dbtide.backend.service;

import com.dbtide.backend.dto.DbtProjectSpec;
import com.dbtide.backend.dto.ProjectSummary;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Models and macros discovered under one dbt project, plus the packages installed into it. */
public record ProjectIndex(
        Path root,
        DbtProjectSpec spec,
        Map<String, Path> models,
        List<ProjectMacro> macros,
        List<ProjectIndex> packages) {

    public ProjectIndex {
        models = Map.copyOf(models);
        macros = List.copyOf(macros);
        packages = List.copyOf(packages);
    }

    public static ProjectIndex empty(Path root) {
        return new ProjectIndex(root, new DbtProjectSpec(null, null, null, null), Map.of(), List.of(), List.of());
    }

    /** Root macros first, then the macros of every package. */
    public List<ProjectMacro> allMacros() {
        List<ProjectMacro> all = new ArrayList<>(macros);
        packages.forEach(installed -> all.addAll(installed.macros()));
        return all;
    }

    /** Looks a macro up by plain name among root macros, or by {@code package.macro}. */
    public Optional<ProjectMacro> macro(String name) {
        Optional<ProjectMacro> local = macros.stream().filter(macro -> macro.name().equals(name)).findFirst();
        if (local.isPresent()) {
            return local;
        }
        return allMacros().stream().filter(macro -> macro.qualifiedName().equals(name)).findFirst();
    }

    public Optional<Path> model(String name) {
        return Optional.ofNullable(models.get(name));
    }

    public ProjectSummary summary() {
        return new ProjectSummary(
                spec.name(),
                root.toString(),
                spec.modelPaths(),
                spec.macroPaths(),
                models.keySet().stream().sorted().toList(),
                allMacros().stream().map(ProjectMacro::qualifiedName).sorted().toList(),
                packages.stream().map(installed -> installed.spec().name()).toList());
    }
}
