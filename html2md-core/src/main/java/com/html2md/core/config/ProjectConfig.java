package com.html2md.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for html2md.
 *
 * <p>Loaded from {@code html2md.yaml}. Defines conversion settings and output defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * converter:
 *   keepDataUris: false
 *   maxDepth: 512
 *
 * output:
 *   format: markdown
 *   directory: "./markdown"
 * }</pre>
 *
 * @param converter conversion settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("converter") ConverterOptions converter,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Compact constructor filling in missing sections.
     */
    public ProjectConfig {
        if (converter == null) {
            converter = ConverterOptions.defaults();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(ConverterOptions.defaults(), OutputConfig.defaults());
    }

    /**
     * Output configuration.
     *
     * @param format output format id ("markdown" or "json")
     * @param directory directory for converted files, null to write next to the input
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("format") String format,
        @JsonProperty("directory") String directory
    ) {
        /**
         * Compact constructor applying defaults.
         */
        public OutputConfig {
            if (format == null || format.isBlank()) {
                format = "markdown";
            }
        }

        /**
         * Creates the default output configuration.
         *
         * @return Markdown output, no directory
         */
        public static OutputConfig defaults() {
            return new OutputConfig("markdown", null);
        }
    }
}
