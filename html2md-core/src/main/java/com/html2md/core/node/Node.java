package com.html2md.core.node;

/**
 * A node of a parsed HTML document tree.
 *
 * <p>The tree is built once by a parser front end and is read-only afterwards. The conversion
 * engine only ever sees two shapes:
 * <ul>
 *   <li>{@link TextNode} - opaque character data</li>
 *   <li>{@link ElementNode} - a tag with ordered attributes and ordered children</li>
 * </ul>
 *
 * @see TextNode
 * @see ElementNode
 */
public interface Node {

    /**
     * Returns the concatenated character data of this node and all of its descendants,
     * in document order, ignoring tag structure.
     *
     * @return flattened text content
     */
    String textContent();
}
