package com.html2md.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-facing settings for a Markdown conversion.
 *
 * <p>Loaded from the {@code converter} section of {@code html2md.yaml} or built directly
 * by library callers. Missing values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * converter:
 *   keepDataUris: false
 *   maxDepth: 512
 * }</pre>
 *
 * @param keepDataUris keep {@code data:} image sources instead of truncating their payload
 * @param maxDepth element nesting ceiling, deeper elements degrade to plain text; {@code <= 0} disables it
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConverterOptions(
    @JsonProperty("keepDataUris") boolean keepDataUris,
    @JsonProperty("maxDepth") Integer maxDepth
) {
    /** Nesting ceiling used when none is configured. */
    public static final int DEFAULT_MAX_DEPTH = 512;

    /**
     * Compact constructor applying defaults.
     */
    public ConverterOptions {
        if (maxDepth == null) {
            maxDepth = DEFAULT_MAX_DEPTH;
        }
    }

    /**
     * Creates the default options: data URIs truncated, depth ceiling of {@value #DEFAULT_MAX_DEPTH}.
     *
     * @return default options
     */
    public static ConverterOptions defaults() {
        return new ConverterOptions(false, DEFAULT_MAX_DEPTH);
    }

    /**
     * Returns a copy with {@code keepDataUris} replaced.
     *
     * @param keep new value
     * @return updated options
     */
    public ConverterOptions withKeepDataUris(boolean keep) {
        return new ConverterOptions(keep, maxDepth);
    }

    /**
     * Returns a copy with {@code maxDepth} replaced.
     *
     * @param depth new ceiling
     * @return updated options
     */
    public ConverterOptions withMaxDepth(int depth) {
        return new ConverterOptions(keepDataUris, depth);
    }

    /**
     * Checks whether an element at the given depth is past the configured ceiling.
     *
     * @param depth element nesting depth, root is 0
     * @return true if the element should degrade to plain text
     */
    public boolean exceedsMaxDepth(int depth) {
        return maxDepth > 0 && depth > maxDepth;
    }
}
