package com.html2md.core.html;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Outcome of converting one HTML document.
 *
 * @param markdown converted Markdown text
 * @param title document title from {@code <title>} or the {@code og:title} meta tag, null if none
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ConversionResult(
    String markdown,
    String title
) {
    /**
     * Compact constructor with validation.
     */
    public ConversionResult {
        Objects.requireNonNull(markdown, "markdown must not be null");
    }
}
