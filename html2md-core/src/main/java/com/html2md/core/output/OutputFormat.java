package com.html2md.core.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.html2md.core.html.ConversionResult;

import java.util.Arrays;
import java.util.Locale;

/**
 * Serialized forms of a {@link ConversionResult}.
 */
public enum OutputFormat {
    /** The Markdown text alone */
    MARKDOWN("md"),

    /** A JSON object with {@code markdown} and {@code title} */
    JSON("json");

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private final String fileExtension;

    OutputFormat(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    /**
     * Resolves a format by id, case-insensitively.
     *
     * @param id "markdown" or "json"
     * @return matching format
     * @throws IllegalArgumentException if the id is unknown
     */
    public static OutputFormat fromId(String id) {
        return Arrays.stream(values())
            .filter(format -> format.name().equalsIgnoreCase(id))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown output format: " + id + ". Use: markdown or json"));
    }

    /**
     * Returns the file extension for this format.
     *
     * @return extension without leading dot
     */
    public String getFileExtension() {
        return fileExtension;
    }

    /**
     * Returns the lower-case id used in configuration.
     *
     * @return format id
     */
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Serializes a conversion result.
     *
     * @param result conversion result
     * @return serialized content
     * @throws IllegalStateException if JSON serialization fails
     */
    public String format(ConversionResult result) {
        if (this == MARKDOWN) {
            return result.markdown();
        }
        try {
            return JSON_MAPPER.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize conversion result", e);
        }
    }
}
