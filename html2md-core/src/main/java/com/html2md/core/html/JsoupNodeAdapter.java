package com.html2md.core.html;

import com.html2md.core.node.Attribute;
import com.html2md.core.node.ElementNode;
import com.html2md.core.node.Node;
import com.html2md.core.node.TextNode;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Element;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Maps a jsoup DOM onto the converter's node model.
 *
 * <p>Elements keep their lower-case tag name, attributes in source order and children in
 * document order. Text and script/style data become {@link TextNode}s with their whole,
 * entity-decoded text. Comments, doctypes and XML declarations are dropped.
 *
 * <p>The walk uses jsoup's iterative {@link NodeTraversor}, so nesting depth is bounded by
 * the heap rather than the call stack.
 */
final class JsoupNodeAdapter {

    private JsoupNodeAdapter() {
        // Utility class
    }

    /**
     * Adapts a jsoup element and its subtree.
     *
     * @param element jsoup element
     * @return equivalent element node
     */
    static ElementNode adapt(Element element) {
        TreeBuilder builder = new TreeBuilder();
        NodeTraversor.traverse(builder, element);
        return builder.root;
    }

    /**
     * Builds element nodes bottom-up: an element's children are collected between its head and
     * tail callbacks, then the finished node is appended to the enclosing element's children.
     */
    private static final class TreeBuilder implements NodeVisitor {

        private final Deque<Frame> open = new ArrayDeque<>();
        private ElementNode root;

        @Override
        public void head(org.jsoup.nodes.Node node, int depth) {
            if (node instanceof Element element) {
                open.push(new Frame(element));
            } else if (node instanceof org.jsoup.nodes.TextNode text) {
                appendChild(new TextNode(text.getWholeText()));
            } else if (node instanceof DataNode data) {
                appendChild(new TextNode(data.getWholeData()));
            }
        }

        @Override
        public void tail(org.jsoup.nodes.Node node, int depth) {
            if (!(node instanceof Element)) {
                return;
            }
            Frame frame = open.pop();
            ElementNode adapted = ElementNode.of(frame.element.normalName(), frame.attributes(), frame.children);
            if (open.isEmpty()) {
                root = adapted;
            } else {
                appendChild(adapted);
            }
        }

        private void appendChild(Node child) {
            Frame parent = open.peek();
            if (parent != null) {
                parent.children.add(child);
            }
        }
    }

    private static final class Frame {

        private final Element element;
        private final List<Node> children = new ArrayList<>();

        private Frame(Element element) {
            this.element = element;
        }

        private List<Attribute> attributes() {
            List<Attribute> attributes = new ArrayList<>();
            for (org.jsoup.nodes.Attribute attribute : element.attributes()) {
                attributes.add(new Attribute(attribute.getKey(), attribute.getValue()));
            }
            return attributes;
        }
    }
}
