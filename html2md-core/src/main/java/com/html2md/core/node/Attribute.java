package com.html2md.core.node;

import java.util.Objects;

/**
 * A single element attribute.
 *
 * @param name attribute name
 * @param value attribute value, empty for boolean attributes
 */
public record Attribute(String name, String value) {

    /**
     * Compact constructor with validation.
     */
    public Attribute {
        Objects.requireNonNull(name, "name must not be null");
        if (value == null) {
            value = "";
        }
    }
}
