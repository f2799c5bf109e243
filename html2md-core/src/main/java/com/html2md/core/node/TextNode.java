package com.html2md.core.node;

import java.util.Objects;

/**
 * Leaf node holding character data.
 *
 * @param content text content, already entity-decoded by the parser
 */
public record TextNode(String content) implements Node {

    /**
     * Compact constructor with validation.
     */
    public TextNode {
        Objects.requireNonNull(content, "content must not be null");
    }

    @Override
    public String textContent() {
        return content;
    }
}
