package com.dbtide.backend.dto;

import java.util.List;

public record ProjectSummary(
        String name,
        String root,
        List<String> modelPaths,
        List<String> macroPaths,
        List<String> models,
        List<String> macros,
        List<String> packages) {
}
