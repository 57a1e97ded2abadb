package com.dbtide.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "dbt.ide")
@Validated
public record DbtIdeProperties(
    @NotBlank
    String projectRoot,

    @Positive
    Long treeDumpTimeoutMs,

    @Positive
    Integer maxSourceCodeLength,

    @Positive
    Integer parserThreads,

    @NotNull
    TraceLevel traceLevel
) {

    /** How much of each analysis request is written to the log. */
    public enum TraceLevel {
        OFF,
        SUMMARY,
        FULL
    }

    @ConstructorBinding
    public DbtIdeProperties {
        projectRoot = projectRoot != null ? projectRoot : ".";
        treeDumpTimeoutMs = treeDumpTimeoutMs != null ? treeDumpTimeoutMs : 1000L;
        maxSourceCodeLength = maxSourceCodeLength != null ? maxSourceCodeLength : 1_000_000;
        parserThreads = parserThreads != null ? parserThreads : 2;
        traceLevel = traceLevel != null ? traceLevel : TraceLevel.SUMMARY;
    }

    public DbtIdeProperties() {
        this(null, null, null, null, null);
    }
}
