package com.html2md.core.node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Element node: a tag name, its attributes and its children.
 *
 * <p>Attributes keep their source order and may contain duplicate names when the parser
 * preserved them; {@link #attribute(String)} returns the first match. Children are kept in
 * document order.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * ElementNode link = ElementNode.of("a",
 *     List.of(new Attribute("href", "https://example.com")),
 *     List.of(new TextNode("Example")));
 *
 * link.attribute("href");   // Optional[https://example.com]
 * link.textContent();       // "Example"
 * }</pre>
 *
 * @param tag lower-case tag name
 * @param attributes ordered attributes
 * @param children ordered child nodes
 */
public record ElementNode(
    String tag,
    List<Attribute> attributes,
    List<Node> children
) implements Node {

    /**
     * Compact constructor with validation.
     */
    public ElementNode {
        Objects.requireNonNull(tag, "tag must not be null");
        tag = tag.toLowerCase(Locale.ROOT);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates an element.
     *
     * @param tag tag name
     * @param attributes ordered attributes
     * @param children ordered child nodes
     * @return new element
     */
    public static ElementNode of(String tag, List<Attribute> attributes, List<Node> children) {
        return new ElementNode(tag, attributes, children);
    }

    /**
     * Creates an element without attributes.
     *
     * @param tag tag name
     * @param children child nodes in document order
     * @return new element
     */
    public static ElementNode of(String tag, Node... children) {
        return new ElementNode(tag, List.of(), List.of(children));
    }

    /**
     * Looks up the first attribute with the given name.
     *
     * @param name attribute name
     * @return attribute value, or empty if absent
     */
    public Optional<String> attribute(String name) {
        for (Attribute attribute : attributes) {
            if (attribute.name().equals(name)) {
                return Optional.of(attribute.value());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the attribute value or an empty string if absent.
     *
     * @param name attribute name
     * @return attribute value or ""
     */
    public String attributeOrEmpty(String name) {
        return attribute(name).orElse("");
    }

    /**
     * Checks whether this element has the given tag.
     *
     * @param name lower-case tag name
     * @return true if the tag matches
     */
    public boolean is(String name) {
        return tag.equals(name);
    }

    /**
     * Returns the element children carrying the given tag, in document order.
     *
     * @param name lower-case tag name
     * @return matching child elements
     */
    public List<ElementNode> childElements(String name) {
        return children.stream()
            .filter(child -> child instanceof ElementNode element && element.is(name))
            .map(ElementNode.class::cast)
            .toList();
    }

    /**
     * Returns the first element child carrying the given tag.
     *
     * @param name lower-case tag name
     * @return first matching child, or empty
     */
    public Optional<ElementNode> firstChildElement(String name) {
        return childElements(name).stream().findFirst();
    }

    @Override
    public String textContent() {
        StringBuilder text = new StringBuilder();
        Deque<Node> pending = new ArrayDeque<>(children);

        // depth-first, document order, no recursion
        while (!pending.isEmpty()) {
            Node node = pending.pollFirst();
            if (node instanceof ElementNode element) {
                List<Node> nested = element.children();
                for (int i = nested.size() - 1; i >= 0; i--) {
                    pending.addFirst(nested.get(i));
                }
            } else {
                text.append(node.textContent());
            }
        }
        return text.toString();
    }
}
