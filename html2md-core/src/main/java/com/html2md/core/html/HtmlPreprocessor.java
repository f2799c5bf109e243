package com.html2md.core.html;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites whitespace between tags into character references before parsing, so that the
 * parser keeps it as text instead of discarding it as insignificant.
 */
final class HtmlPreprocessor {

    private static final Pattern SPACES_BETWEEN_TAGS = Pattern.compile(">( +)<");
    private static final Pattern NEWLINES_BETWEEN_TAGS = Pattern.compile(">[\\n\\r]+<");

    private static final String SPACE_REFERENCE = "&#32;";
    private static final String NEWLINE_REFERENCE = "&#10;";

    private HtmlPreprocessor() {
        // Utility class
    }

    /**
     * Replaces each run of spaces between two tags by one space reference per space, and each
     * run of line breaks between two tags by a single newline reference.
     *
     * @param html raw HTML
     * @return HTML with inter-tag whitespace encoded
     */
    static String preserveInterTagWhitespace(String html) {
        Matcher spaces = SPACES_BETWEEN_TAGS.matcher(html);
        StringBuilder encoded = new StringBuilder();
        while (spaces.find()) {
            String replacement = ">" + SPACE_REFERENCE.repeat(spaces.group(1).length()) + "<";
            spaces.appendReplacement(encoded, Matcher.quoteReplacement(replacement));
        }
        spaces.appendTail(encoded);

        return NEWLINES_BETWEEN_TAGS.matcher(encoded).replaceAll(">" + NEWLINE_REFERENCE + "<");
    }
}
