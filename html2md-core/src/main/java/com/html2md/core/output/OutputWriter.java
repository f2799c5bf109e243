package com.html2md.core.output;

import com.html2md.core.html.ConversionResult;

/**
 * Writes a conversion result to a destination (console, file).
 *
 * <p>Implementations should validate the settings they need from {@link OutputContext}
 * and throw {@link IllegalStateException} when the destination cannot be written.
 *
 * @see ConsoleOutputWriter
 * @see FileOutputWriter
 */
public interface OutputWriter {

    /**
     * Returns unique identifier for this writer.
     *
     * @return lower-case writer id, e.g. "console" or "file"
     */
    String getId();

    /**
     * Writes the result.
     *
     * @param result converted document
     * @param context destination and format
     * @throws IllegalStateException if the destination cannot be written
     */
    void write(ConversionResult result, OutputContext context);
}
