package com.html2md.core.output;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Context provided to writers.
 *
 * @param target destination file, null for writers that do not write files
 * @param format serialized form to write
 */
public record OutputContext(
    Path target,
    OutputFormat format
) {
    /**
     * Compact constructor with validation.
     */
    public OutputContext {
        Objects.requireNonNull(format, "format must not be null");
    }
}
