package com.html2md.core.convert;

import com.html2md.core.node.ElementNode;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Inline rendering rules: links, images, emphasis and inline code.
 */
class InlineFormatter {

    private static final Pattern WHITESPACE_AROUND_NEWLINE = Pattern.compile("\\s*\\n\\s*");
    private static final Pattern REPEATED_SPACES = Pattern.compile(" {2,}");

    private static final String DATA_URI_PREFIX = "data:";
    private static final String TRUNCATION_SUFFIX = "...";

    private final MarkdownConverter converter;

    InlineFormatter(MarkdownConverter converter) {
        this.converter = converter;
    }

    /**
     * Renders {@code <a>}. A link without visible text renders nothing; a link without an
     * {@code href} or with a rejected scheme degrades to its text.
     */
    String link(ElementNode element, ConversionContext context) {
        String rendered = converter.convert(element.children(), context);
        if (rendered.isEmpty()) {
            return "";
        }

        String text = normalizeLinkText(rendered);
        Optional<String> href = element.attribute("href");
        if (href.isEmpty() || !LinkUrls.hasAllowedScheme(href.get())) {
            return text;
        }

        String url = LinkUrls.escapeUrl(href.get());
        String title = element.attribute("title")
            .map(value -> " \"" + LinkUrls.escapeTitle(value) + "\"")
            .orElse("");
        return "[" + text + "](" + url + title + ")";
    }

    /**
     * Renders {@code <img>}, truncating {@code data:} payloads unless configured otherwise.
     */
    String image(ElementNode element, ConversionContext context) {
        String alt = element.attributeOrEmpty("alt");
        String src = element.attributeOrEmpty("src");
        String title = element.attributeOrEmpty("title");

        if (src.startsWith(DATA_URI_PREFIX) && !context.options().keepDataUris()) {
            src = truncateDataUri(src);
        }

        String titlePart = title.isEmpty() ? "" : " \"" + LinkUrls.escapeTitle(title) + "\"";
        return "![" + alt + "](" + src + titlePart + ")";
    }

    String bold(ElementNode element, ConversionContext context) {
        return "**" + converter.convert(element.children(), context) + "**";
    }

    String italic(ElementNode element, ConversionContext context) {
        return "*" + converter.convert(element.children(), context) + "*";
    }

    String inlineCode(ElementNode element, ConversionContext context) {
        return "`" + converter.convert(element.children(), context) + "`";
    }

    static String normalizeLinkText(String text) {
        String collapsed = WHITESPACE_AROUND_NEWLINE.matcher(text.strip()).replaceAll(" ");
        return REPEATED_SPACES.matcher(collapsed).replaceAll(" ");
    }

    // keeps the media type and encoding descriptor, drops the payload
    static String truncateDataUri(String src) {
        int comma = src.indexOf(',');
        String descriptor = comma < 0 ? src : src.substring(0, comma);
        return descriptor + TRUNCATION_SUFFIX;
    }
}
