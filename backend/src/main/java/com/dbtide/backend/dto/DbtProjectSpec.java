package com.dbtide.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** The parts of {@code dbt_project.yml} the backend reads; everything else in the file is ignored. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DbtProjectSpec(
        @JsonProperty("name") String name,
        @JsonProperty("model-paths") List<String> modelPaths,
        @JsonProperty("macro-paths") List<String> macroPaths,
        @JsonProperty("packages-install-path") String packagesInstallPath) {

    public DbtProjectSpec {
        name = name != null ? name : "";
        modelPaths = modelPaths != null ? List.copyOf(modelPaths) : List.of("models");
        macroPaths = macroPaths != null ? List.copyOf(macroPaths) : List.of("macros");
        packagesInstallPath = packagesInstallPath != null ? packagesInstallPath : "dbt_packages";
    }
}
