package com.dbtide.backend.outline;

/** @param defaultValue source text of the default expression, {@code null} for a required argument */
public record MacroArgument(String name, String defaultValue) {

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public String toString() {
        return hasDefault() ? name + "=" + defaultValue : name;
    }
}
