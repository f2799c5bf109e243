package com.html2md.core.convert;

import com.html2md.core.node.ElementNode;
import com.html2md.core.node.Node;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Block rendering rules: headings, paragraphs, lists, code blocks, blockquotes and
 * definition lists.
 *
 * <p>Every block emits its own leading and trailing newlines; the normalizer later collapses
 * the surplus. Nested lists are not indented: they follow their parent item after a blank
 * line.
 */
class BlockFormatter {

    /** Attribute some code hosts use to carry the exact clipboard text of a snippet. */
    static final String SNIPPET_COPY_ATTRIBUTE = "data-snippet-clipboard-copy-content";

    static final String FENCE = "```";

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n{2,}");

    private final MarkdownConverter converter;

    BlockFormatter(MarkdownConverter converter) {
        this.converter = converter;
    }

    String heading(ElementNode element, int level, ConversionContext context) {
        String text = converter.convert(element.children(), context).strip();
        return "\n" + "#".repeat(level) + " " + text + "\n";
    }

    String paragraph(ElementNode element, ConversionContext context) {
        return "\n\n" + converter.convert(element.children(), context).strip() + "\n";
    }

    String unorderedList(ElementNode element, ConversionContext context) {
        StringBuilder items = new StringBuilder();
        for (ElementNode item : element.childElements("li")) {
            items.append(converter.convert(item, context.withListMarker(ConversionContext.BULLET_MARKER)));
        }
        return wrapList(items.toString(), context);
    }

    /**
     * Renders {@code <ol>}. Numbers count {@code <li>} children only, so stray text between
     * items never shifts the numbering.
     */
    String orderedList(ElementNode element, ConversionContext context) {
        StringBuilder items = new StringBuilder();
        int number = 1;
        for (ElementNode item : element.childElements("li")) {
            items.append(converter.convert(item, context.withListMarker(number + ". ")));
            number++;
        }
        return wrapList(items.toString(), context);
    }

    /**
     * Renders {@code <li>}: the marker, the trimmed item content, then any nested lists
     * separated from the item by a blank line.
     */
    String listItem(ElementNode element, ConversionContext context) {
        List<Node> nestedLists = new ArrayList<>();
        List<Node> content = new ArrayList<>();
        for (Node child : element.children()) {
            if (isList(child)) {
                nestedLists.add(child);
            } else {
                content.add(child);
            }
        }

        String text = converter.convert(content, context).strip();
        String nested = nestedLists.isEmpty()
            ? ""
            : converter.convert(nestedLists, context.withInListItem(true));
        return context.listMarker() + text + nested + "\n";
    }

    /**
     * Renders {@code <pre>} as a fenced code block.
     *
     * <p>A {@code pre} wrapping a single {@code code} element keeps the code content and
     * renders any markup inside it. Any other structure (typically syntax-highlighter spans)
     * is flattened to its text.
     */
    String preformatted(ElementNode element, ConversionContext context) {
        List<Node> children = element.children();
        String code;
        if (children.size() == 1 && children.get(0) instanceof ElementNode only && only.is("code")) {
            code = converter.convert(only.children(), context.reset());
        } else {
            code = element.textContent();
        }
        return fenced(decodeEntities(code).stripTrailing());
    }

    /**
     * Renders {@code <div>}: a raw clipboard snippet when present, otherwise the children.
     */
    String division(ElementNode element, ConversionContext context) {
        Optional<String> snippet = element.attribute(SNIPPET_COPY_ATTRIBUTE);
        if (snippet.isPresent()) {
            return fenced(decodeEntities(snippet.get()).strip());
        }
        return converter.convert(element.children(), context);
    }

    /**
     * Renders {@code <blockquote>}: each paragraph of the rendered content is quoted line by
     * line and paragraphs are separated by a bare {@code >} line.
     */
    String blockquote(ElementNode element, ConversionContext context) {
        String content = converter.convert(element.children(), context).strip();

        List<String> quoted = new ArrayList<>();
        for (String paragraph : PARAGRAPH_BREAK.split(content)) {
            String trimmed = paragraph.strip();
            if (!trimmed.isEmpty()) {
                quoted.add("> " + trimmed.replace("\n", "\n> "));
            }
        }
        return String.join("\n>\n", quoted);
    }

    String definitionList(ElementNode element, ConversionContext context) {
        StringBuilder items = new StringBuilder();
        for (Node child : element.children()) {
            if (child instanceof ElementNode item && (item.is("dt") || item.is("dd"))) {
                items.append(converter.convert(item, context));
            }
        }
        return "\n\n" + items + "\n";
    }

    String definitionTerm(ElementNode element, ConversionContext context) {
        return "**" + converter.convert(element.children(), context) + "**\n";
    }

    String definitionDescription(ElementNode element, ConversionContext context) {
        return ": " + converter.convert(element.children(), context) + "\n\n";
    }

    static String fenced(String code) {
        return "\n" + FENCE + "\n" + code + "\n" + FENCE + "\n";
    }

    private static String wrapList(String items, ConversionContext context) {
        if (context.inListItem()) {
            return "\n\n" + items;
        }
        return "\n" + items + "\n";
    }

    private static boolean isList(Node node) {
        return node instanceof ElementNode element && (element.is("ul") || element.is("ol"));
    }

    private static String decodeEntities(String text) {
        return Parser.unescapeEntities(text, false);
    }
}
