package com.html2md.core.convert;

import com.html2md.core.config.ConverterOptions;

import java.util.Objects;

/**
 * Immutable state threaded through the recursive rendering calls.
 *
 * <p>Separates the user configuration ({@link #options()}) from the traversal state that only
 * the engine sets: the marker of the list item being rendered, whether a nested list lives
 * inside a list item, the cell tag of the current table row and the element depth. Each
 * {@code with*} method returns a copy with one field overridden; nothing is ever mutated.
 *
 * @param options user configuration
 * @param listMarker marker prefixed to the current list item ("- " or "N. ")
 * @param inListItem true while rendering a list nested in a list item
 * @param cellTag tag that counts as a cell in the current row ("td" or "th")
 * @param depth element nesting depth, root is 0
 */
public record ConversionContext(
    ConverterOptions options,
    String listMarker,
    boolean inListItem,
    String cellTag,
    int depth
) {
    static final String BULLET_MARKER = "- ";
    static final String DATA_CELL = "td";
    static final String HEADER_CELL = "th";

    /**
     * Compact constructor with validation.
     */
    public ConversionContext {
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(listMarker, "listMarker must not be null");
        Objects.requireNonNull(cellTag, "cellTag must not be null");
    }

    /**
     * Creates the context for a top-level conversion.
     *
     * @param options user configuration
     * @return root context
     */
    public static ConversionContext root(ConverterOptions options) {
        return new ConversionContext(options, BULLET_MARKER, false, DATA_CELL, 0);
    }

    /**
     * Returns a context carrying the same options and depth, with list and table state dropped.
     *
     * @return fresh context
     */
    public ConversionContext reset() {
        return new ConversionContext(options, BULLET_MARKER, false, DATA_CELL, depth);
    }

    public ConversionContext withListMarker(String marker) {
        return new ConversionContext(options, marker, inListItem, cellTag, depth);
    }

    public ConversionContext withInListItem(boolean nested) {
        return new ConversionContext(options, listMarker, nested, cellTag, depth);
    }

    public ConversionContext withCellTag(String tag) {
        return new ConversionContext(options, listMarker, inListItem, tag, depth);
    }

    /**
     * Returns a copy one level deeper in the element tree.
     *
     * @return descended context
     */
    public ConversionContext descend() {
        return new ConversionContext(options, listMarker, inListItem, cellTag, depth + 1);
    }
}
