package com.html2md.core.convert;

import com.html2md.core.config.ConverterOptions;
import com.html2md.core.node.ElementNode;
import com.html2md.core.node.Node;
import com.html2md.core.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Renders a parsed HTML node tree as Markdown.
 *
 * <p>Rendering is a depth-first walk. Each element is dispatched on its {@link HtmlTag} to
 * exactly one formatter, which returns the element's Markdown fragment; fragments are
 * concatenated bottom-up. Text nodes are emitted verbatim. Tags without a rule render their
 * children only, and skipped tags ({@code script}, {@code nav}, {@code form}...) render
 * nothing at all.
 *
 * <p>The converter holds no mutable state and can be shared between threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MarkdownConverter converter = new MarkdownConverter();
 * Node root = ElementNode.of("h1", new TextNode("Hello World"));
 *
 * String markdown = converter.convertDocument(root, ConverterOptions.defaults());
 * // "# Hello World\n"
 * }</pre>
 *
 * @see MarkdownNormalizer
 * @see ConversionContext
 */
public class MarkdownConverter {

    private static final Logger log = LoggerFactory.getLogger(MarkdownConverter.class);

    private final InlineFormatter inlineFormatter;
    private final BlockFormatter blockFormatter;
    private final TableFormatter tableFormatter;
    private final MarkdownNormalizer normalizer;

    public MarkdownConverter() {
        this.inlineFormatter = new InlineFormatter(this);
        this.blockFormatter = new BlockFormatter(this);
        this.tableFormatter = new TableFormatter(this);
        this.normalizer = new MarkdownNormalizer();
    }

    /**
     * Converts a whole document: renders the tree, then normalizes blank lines and indentation.
     *
     * @param root root node, usually the {@code body} element
     * @param options user configuration
     * @return final Markdown text
     */
    public String convertDocument(Node root, ConverterOptions options) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(options, "options must not be null");

        String rendered = convert(root, ConversionContext.root(options));
        String markdown = normalizer.normalize(rendered);
        log.debug("Rendered {} characters, {} after normalization", rendered.length(), markdown.length());
        return markdown;
    }

    /**
     * Renders a sequence of sibling nodes in document order without separators.
     *
     * @param nodes nodes to render
     * @param context traversal context
     * @return concatenated Markdown fragments
     */
    public String convert(List<? extends Node> nodes, ConversionContext context) {
        StringBuilder markdown = new StringBuilder();
        for (Node node : nodes) {
            markdown.append(convert(node, context));
        }
        return markdown.toString();
    }

    /**
     * Renders a single node.
     *
     * @param node node to render
     * @param context traversal context
     * @return Markdown fragment, possibly empty
     */
    public String convert(Node node, ConversionContext context) {
        if (node instanceof TextNode text) {
            return text.content();
        }
        if (node instanceof ElementNode element) {
            return convertElement(element, context.descend());
        }
        return "";
    }

    private String convertElement(ElementNode element, ConversionContext context) {
        HtmlTag tag = HtmlTag.fromName(element.tag());
        if (tag.isSkipped()) {
            return "";
        }

        if (context.options().exceedsMaxDepth(context.depth())) {
            log.debug("Element <{}> at depth {} exceeds the nesting limit, emitting plain text",
                element.tag(), context.depth());
            return plainText(element);
        }

        return switch (tag) {
            case H1, H2, H3, H4, H5, H6 -> blockFormatter.heading(element, tag.headingLevel(), context);
            case P -> blockFormatter.paragraph(element, context);
            case UL -> blockFormatter.unorderedList(element, context);
            case OL -> blockFormatter.orderedList(element, context);
            case LI -> blockFormatter.listItem(element, context);
            case PRE -> blockFormatter.preformatted(element, context);
            case DIV -> blockFormatter.division(element, context);
            case BLOCKQUOTE -> blockFormatter.blockquote(element, context);
            case DL -> blockFormatter.definitionList(element, context);
            case DT -> blockFormatter.definitionTerm(element, context);
            case DD -> blockFormatter.definitionDescription(element, context);
            case A -> inlineFormatter.link(element, context);
            case IMG -> inlineFormatter.image(element, context);
            case STRONG -> inlineFormatter.bold(element, context);
            case EM -> inlineFormatter.italic(element, context);
            case CODE -> inlineFormatter.inlineCode(element, context);
            case TABLE -> tableFormatter.table(element, context);
            case THEAD -> tableFormatter.header(element, context);
            case TBODY -> tableFormatter.body(element, context);
            case TR -> tableFormatter.row(element, context);
            case TH, TD -> tableFormatter.cell(element, context);
            default -> convert(element.children(), context);
        };
    }

    /**
     * Flattens a subtree to its text without recursion, still dropping skipped tags.
     */
    private static String plainText(ElementNode root) {
        StringBuilder text = new StringBuilder();
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);

        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (node instanceof TextNode leaf) {
                text.append(leaf.content());
            } else if (node instanceof ElementNode element && !HtmlTag.fromName(element.tag()).isSkipped()) {
                List<Node> children = element.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    pending.push(children.get(i));
                }
            }
        }
        return text.toString();
    }
}
