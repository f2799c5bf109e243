package com.html2md.core.convert;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tags the converter knows how to render.
 *
 * <p>This is the single table mapping tag names to rendering rules. Any tag not listed here
 * resolves to {@link #OTHER} and is rendered as a transparent passthrough. Tags flagged as
 * skipped are discarded together with their whole subtree.
 */
public enum HtmlTag {
    H1, H2, H3, H4, H5, H6,
    P,
    A,
    IMG,
    STRONG,
    EM,
    CODE,
    PRE,
    DIV,
    SPAN,
    UL,
    OL,
    LI,
    BLOCKQUOTE,
    TABLE,
    THEAD,
    TBODY,
    TR,
    TH,
    TD,
    DL,
    DT,
    DD,

    SCRIPT(true),
    STYLE(true),
    BUTTON(true),
    FORM(true),
    INPUT(true),
    NAV(true),
    FOOTER(true),

    /** Any tag without a dedicated rule. */
    OTHER;

    private static final Map<String, HtmlTag> BY_NAME = Arrays.stream(values())
        .filter(tag -> tag != OTHER)
        .collect(Collectors.toUnmodifiableMap(HtmlTag::tagName, Function.identity()));

    private final boolean skipped;

    HtmlTag() {
        this(false);
    }

    HtmlTag(boolean skipped) {
        this.skipped = skipped;
    }

    /**
     * Resolves a tag name.
     *
     * @param name tag name, any case
     * @return matching tag, or {@link #OTHER}
     */
    public static HtmlTag fromName(String name) {
        if (name == null) {
            return OTHER;
        }
        return BY_NAME.getOrDefault(name.toLowerCase(Locale.ROOT), OTHER);
    }

    /**
     * Returns the lower-case HTML tag name.
     *
     * @return tag name
     */
    public String tagName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether elements with this tag are dropped without visiting their children.
     *
     * @return true for non-content elements (scripts, forms, navigation)
     */
    public boolean isSkipped() {
        return skipped;
    }

    /**
     * Heading level for {@code h1}..{@code h6}.
     *
     * @return level 1-6, or 0 if this is not a heading
     */
    public int headingLevel() {
        return switch (this) {
            case H1 -> 1;
            case H2 -> 2;
            case H3 -> 3;
            case H4 -> 4;
            case H5 -> 5;
            case H6 -> 6;
            default -> 0;
        };
    }
}
