package com.html2md.core.convert;

import java.util.ArrayList;
import java.util.List;

/**
 * Post-processing pass applied once to the fully rendered Markdown.
 *
 * <p>Steps:
 * <ol>
 *   <li>strip whitespace from the start of the document</li>
 *   <li>collapse every run of three or more newlines to two</li>
 *   <li>strip leading whitespace from every line</li>
 * </ol>
 *
 * <p>Steps 2 and 3 skip fenced code. A line whose first non-blank characters are
 * {@value BlockFormatter#FENCE} toggles the fence state, whatever its indentation, and loses
 * that indentation in step 3; lines inside a fence are kept verbatim. Fences are assumed to be
 * paired: an unmatched marker leaves the rest of the document untouched.
 *
 * <p>Normalizing already normalized text returns it unchanged.
 */
public class MarkdownNormalizer {

    /**
     * Normalizes rendered Markdown.
     *
     * @param markdown rendered text
     * @return normalized text
     */
    public String normalize(String markdown) {
        String text = markdown.stripLeading();
        return stripLineIndentation(collapseBlankLines(text));
    }

    /**
     * Collapses runs of blank lines outside fences so that at most one empty line separates
     * two blocks. Whitespace-only lines count as blank since the indentation pass empties them.
     *
     * @param text Markdown text
     * @return text with at most two consecutive newlines outside fences
     */
    String collapseBlankLines(String text) {
        List<String> kept = new ArrayList<>();
        boolean insideFence = false;
        boolean previousEmpty = false;

        for (String line : text.split("\n", -1)) {
            if (isFence(line)) {
                insideFence = !insideFence;
                kept.add(line);
                previousEmpty = false;
            } else if (insideFence) {
                kept.add(line);
                previousEmpty = false;
            } else if (line.isBlank()) {
                if (!previousEmpty) {
                    kept.add(line);
                }
                previousEmpty = true;
            } else {
                kept.add(line);
                previousEmpty = false;
            }
        }
        return String.join("\n", kept);
    }

    /**
     * Strips leading whitespace from every line outside fenced code.
     *
     * @param text Markdown text
     * @return text without accidental indentation
     */
    String stripLineIndentation(String text) {
        List<String> lines = new ArrayList<>();
        boolean insideFence = false;

        for (String line : text.split("\n", -1)) {
            if (isFence(line)) {
                insideFence = !insideFence;
                lines.add(line.stripLeading());
            } else if (insideFence) {
                lines.add(line);
            } else {
                lines.add(line.stripLeading());
            }
        }
        return String.join("\n", lines);
    }

    // both passes must agree on fences, including indented markers the second pass un-indents
    private static boolean isFence(String line) {
        return line.stripLeading().startsWith(BlockFormatter.FENCE);
    }
}
