package com.codemeter.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration, loaded from {@code codemeter.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * revision:
 *   backend: auto
 *   recurse: true
 *
 * output:
 *   format: console
 *   colors: false
 * }</pre>
 *
 * @param revision revision settings
 * @param output report settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("revision") RevisionConfig revision,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Compact constructor filling missing sections with defaults.
     */
    public ProjectConfig {
        if (revision == null) {
            revision = RevisionConfig.defaults();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    /**
     * Creates the default configuration: auto backend, recursive walk, console report.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(RevisionConfig.defaults(), OutputConfig.defaults());
    }

    /**
     * Report settings.
     *
     * @param format renderer id, e.g. {@code console} or {@code json}
     * @param colors whether the console renderer may use ANSI colors
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("format") String format,
        @JsonProperty("colors") Boolean colors
    ) {
        public static OutputConfig defaults() {
            return new OutputConfig("console", true);
        }

        public String effectiveFormat() {
            return format != null && !format.isBlank() ? format : "console";
        }

        public boolean effectiveColors() {
            return colors == null || colors;
        }
    }
}
