package com.html2md.core.html;

import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Metadata about a document stream handed to a {@link DocumentConverter}.
 *
 * @param mimetype MIME type, may be null
 * @param extension file extension including the leading dot, may be null
 * @param charset character set name, null means UTF-8
 * @param url source URL, may be null
 */
public record StreamInfo(
    String mimetype,
    String extension,
    String charset,
    String url
) {
    private static final String HTML_MIME_TYPE = "text/html";

    /**
     * Describes an in-memory HTML string.
     *
     * @return HTML stream info in UTF-8
     */
    public static StreamInfo html() {
        return new StreamInfo(HTML_MIME_TYPE, ".html", StandardCharsets.UTF_8.name(), null);
    }

    /**
     * Describes a file, taking the extension from its name. The MIME type is left unknown.
     *
     * @param path file path
     * @return stream info in UTF-8
     */
    public static StreamInfo forPath(Path path) {
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        String extension = lastDot > 0 ? fileName.substring(lastDot) : "";
        return new StreamInfo(null, extension, StandardCharsets.UTF_8.name(), null);
    }

    /**
     * Resolves the charset, defaulting to UTF-8.
     *
     * @return charset to decode the stream with
     * @throws UnsupportedEncodingException if the name is illegal or not supported by this JVM
     */
    public Charset resolveCharset() throws UnsupportedEncodingException {
        if (charset == null || charset.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(charset);
        } catch (IllegalArgumentException e) {
            UnsupportedEncodingException unsupported =
                new UnsupportedEncodingException("Unsupported charset: " + charset);
            unsupported.initCause(e);
            throw unsupported;
        }
    }
}
