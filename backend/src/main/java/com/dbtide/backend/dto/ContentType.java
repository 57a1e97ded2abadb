package com.dbtide.backend.dto;

import java.util.Locale;

/** Host language around the template. Only used to route documents; both parse the same way. */
public enum ContentType {
    TEMPLATED_SQL,
    TEMPLATED_YAML;

    public static ContentType fromUri(String uri) {
        String lower = uri == null ? "" : uri.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yml") || lower.endsWith(".yaml") ? TEMPLATED_YAML : TEMPLATED_SQL;
    }
}
