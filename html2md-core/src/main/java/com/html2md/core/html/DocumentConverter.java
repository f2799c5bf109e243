package com.html2md.core.html;

import com.html2md.core.config.ConverterOptions;

import java.io.IOException;
import java.io.InputStream;

/**
 * Converts a document stream to Markdown.
 *
 * <p>Implementations declare which streams they handle through {@link #accepts(StreamInfo)};
 * callers check it before calling {@link #convert(InputStream, StreamInfo, ConverterOptions)}.
 *
 * @see HtmlDocumentConverter
 */
public interface DocumentConverter {

    /**
     * Checks whether this converter handles the described stream.
     *
     * @param streamInfo stream metadata
     * @return true if the stream can be converted
     */
    boolean accepts(StreamInfo streamInfo);

    /**
     * Reads and converts a document.
     *
     * @param input document bytes, not closed by this method
     * @param streamInfo stream metadata
     * @param options conversion settings
     * @return converted Markdown and title
     * @throws IOException if the stream cannot be read
     */
    ConversionResult convert(InputStream input, StreamInfo streamInfo, ConverterOptions options) throws IOException;
}
