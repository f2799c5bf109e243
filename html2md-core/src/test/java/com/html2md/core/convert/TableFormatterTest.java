package com.html2md.core.convert;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for pipe table rendering.
 */
class TableFormatterTest extends ConverterTestBase {

    @Test
    void table_withHeadAndBody_rendersHeaderSeparatorAndRows() {
        String markdown = render(el("table",
            el("thead", el("tr", el("th", text("Header 1")), el("th", text("Header 2")))),
            el("tbody",
                el("tr", el("td", text("R1C1")), el("td", text("R1C2"))),
                el("tr", el("td", text("R2C1")), el("td", text("R2C2"))))));

        assertThat(markdown).isEqualTo(
            "\n\n| Header 1 | Header 2 |\n| --- | --- |\n| R1C1 | R1C2 |\n| R2C1 | R2C2 |\n\n");
    }

    @Test
    void table_withoutBody_usesDirectRows() {
        String markdown = render(el("table",
            el("tr", el("td", text("Simple 1")), el("td", text("Simple 2")))));

        assertThat(markdown).isEqualTo("\n\n| Simple 1 | Simple 2 |\n\n");
    }

    @Test
    void table_withEmptyHead_rendersBodyOnly() {
        String markdown = render(el("table",
            el("thead"),
            el("tbody", el("tr", el("td", text("x"))))));

        assertThat(markdown).isEqualTo("\n\n| x |\n\n");
    }

    @Test
    void header_separatorMatchesHeaderCellCount() {
        String markdown = render(el("thead",
            el("tr", el("th", text("A")), el("th", text("B")), el("th", text("C")))));

        assertThat(markdown).isEqualTo("| A | B | C |\n| --- | --- | --- |\n");
    }

    @Test
    void header_usesFirstRowOnly() {
        String markdown = render(el("thead",
            el("tr", el("th", text("A"))),
            el("tr", el("th", text("ignored")))));

        assertThat(markdown).isEqualTo("| A |\n| --- |\n");
    }

    @Test
    void row_dropsWhitespaceAndNonCellChildren() {
        String markdown = render(el("tr",
            text("\n    "),
            el("td", text(" a ")),
            text(" "),
            el("span", text("stray")),
            el("td", text("b"))));

        assertThat(markdown).isEqualTo("| a | b |\n");
    }

    @Test
    void row_keepsHeaderCellsInBodyRows() {
        String markdown = render(el("tr", el("th", text("Row")), el("td", text("value"))));

        assertThat(markdown).isEqualTo("| Row | value |\n");
    }

    @Test
    void cell_keepsInlineMarkup() {
        String markdown = render(el("tr", el("td", el("strong", text("bold"))), el("td", el("code", text("x")))));

        assertThat(markdown).isEqualTo("| **bold** | `x` |\n");
    }

    @Test
    void table_normalized_hasNoLeadingBlankLines() {
        String markdown = convert(el("table",
            el("thead", el("tr", el("th", text("H")))),
            el("tbody", el("tr", el("td", text("v"))))));

        assertThat(markdown).isEqualTo("| H |\n| --- |\n| v |\n");
    }
}
