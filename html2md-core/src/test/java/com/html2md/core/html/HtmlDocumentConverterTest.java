package com.html2md.core.html;

import com.html2md.core.config.ConverterOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests from HTML text to Markdown.
 */
class HtmlDocumentConverterTest {

    @TempDir
    Path tempDir;

    private HtmlDocumentConverter converter;

    @BeforeEach
    void setUp() {
        converter = new HtmlDocumentConverter();
    }

    @Test
    void htmlToText_heading_rendersAtxHeading() {
        assertThat(converter.htmlToText("<h1>Hello World</h1>")).isEqualTo("# Hello World\n");
    }

    @Test
    void convertString_mixedContent_rendersBlocksSeparatedByBlankLines() {
        String html = "<h1>Title</h1><p>Some <strong>bold</strong> and <em>italic</em> text</p>"
            + "<ul><li>One</li><li>Two</li></ul>";

        ConversionResult result = converter.convertString(html);

        assertThat(result.markdown())
            .isEqualTo("# Title\n\nSome **bold** and *italic* text\n\n- One\n- Two\n");
        assertThat(result.title()).isNull();
    }

    @Test
    void convertString_fullDocument_extractsTitleAndConvertsBody() {
        String html = """
            <html>
            <head><title>Doc</title></head>
            <body>
            <p>Hi</p>
            </body>
            </html>
            """;

        ConversionResult result = converter.convertString(html);

        assertThat(result.title()).isEqualTo("Doc");
        assertThat(result.markdown()).isEqualTo("Hi\n");
    }

    @Test
    void convertString_openGraphTitle_usedWhenNoTitleElement() {
        String html = "<html><head><meta property=\"og:title\" content=\"OG Title\"></head>"
            + "<body><p>x</p></body></html>";

        assertThat(converter.convertString(html).title()).isEqualTo("OG Title");
    }

    @Test
    void convertString_titleElement_winsOverOpenGraph() {
        String html = "<html><head><title>Page</title><meta property=\"og:title\" content=\"OG\"></head>"
            + "<body><p>x</p></body></html>";

        assertThat(converter.convertString(html).title()).isEqualTo("Page");
    }

    @Test
    void convertString_scriptsAndStyles_areRemoved() {
        String html = "<p>a</p><script>alert(1)</script><style>p { color: red }</style><p>b</p>";

        assertThat(converter.htmlToText(html)).isEqualTo("a\n\nb\n");
    }

    @Test
    void convertString_newlinesBetweenBlocks_collapseToOneBlankLine() {
        assertThat(converter.htmlToText("<p>a</p>\n\n\n<p>b</p>")).isEqualTo("a\n\nb\n");
    }

    @Test
    void convertString_spacesBetweenInlineTags_arePreserved() {
        assertThat(converter.htmlToText("<p><strong>a</strong>   <em>b</em></p>")).isEqualTo("**a**   *b*\n");
    }

    @Test
    void convertString_javascriptLink_rendersTextOnly() {
        assertThat(converter.htmlToText("<p><a href=\"javascript:alert('x')\">Click</a></p>"))
            .isEqualTo("Click\n");
    }

    @Test
    void convertString_multiLineLinkText_collapsesToOneLine() {
        String html = "<a href=\"/pulls\">\n      Pull requests\n    </a>";

        assertThat(converter.htmlToText(html)).isEqualTo("[Pull requests](/pulls)");
    }

    @Test
    void convertString_nestedList_rendersNestedItemsAfterBlankLine() {
        String html = "<ul><li>Item 1</li><li>Item 2<ul><li>Nested</li></ul></li></ul>";

        assertThat(converter.htmlToText(html)).isEqualTo("- Item 1\n- Item 2\n\n- Nested\n");
    }

    @Test
    void convertString_table_rendersPipeTable() {
        String html = "<table><thead><tr><th>H1</th><th>H2</th></tr></thead>"
            + "<tbody><tr><td>a</td><td>b</td></tr></tbody></table>";

        assertThat(converter.htmlToText(html)).isEqualTo("| H1 | H2 |\n| --- | --- |\n| a | b |\n");
    }

    @Test
    void convertString_indentedTableMarkup_ignoresWhitespace() {
        String html = """
            <table>
              <tr>
                <td>a</td>
                <td>b</td>
              </tr>
            </table>
            """;

        assertThat(converter.htmlToText(html)).isEqualTo("| a | b |\n");
    }

    @Test
    void convertString_codeBlock_keepsIndentation() {
        String html = "<p>Example:</p><pre><code>def f():\n    return 1\n</code></pre>";

        assertThat(converter.htmlToText(html)).isEqualTo("Example:\n\n```\ndef f():\n    return 1\n```\n");
    }

    @Test
    void convertString_blockquote_quotesParagraphs() {
        assertThat(converter.htmlToText("<blockquote><p>A</p><p>B</p></blockquote>")).isEqualTo("> A\n>\n> B");
    }

    @Test
    void convertString_dataUriImage_truncatedUnlessConfigured() {
        String html = "<img src=\"data:image/png;base64,AAAA\" alt=\"x\">";

        assertThat(converter.htmlToText(html)).isEqualTo("![x](data:image/png;base64...)");
        assertThat(converter.convertString(html, ConverterOptions.defaults().withKeepDataUris(true)).markdown())
            .isEqualTo("![x](data:image/png;base64,AAAA)");
    }

    @Test
    void convertString_beyondMaxDepth_degradesToPlainText() {
        String html = "<div><div><div><strong>deep</strong></div></div></div>";

        ConversionResult result = converter.convertString(html, ConverterOptions.defaults().withMaxDepth(2));

        assertThat(result.markdown()).isEqualTo("deep");
    }

    @Test
    void convertString_sqlOperators_keptInsideCodeBlock() {
        String html = "<pre><code>SELECT embedding <-> '[3,1,2]' AS distance FROM items;</code></pre>";

        assertThat(converter.htmlToText(html))
            .isEqualTo("```\nSELECT embedding <-> '[3,1,2]' AS distance FROM items;\n```\n");
    }

    @Test
    void convertString_highlightedPre_flattensSpans() {
        String html = "<pre><span class=\"pl-k\">SELECT</span> <span class=\"pl-c1\">AVG</span>(embedding) "
            + "<span class=\"pl-k\">FROM</span> items;</pre>";

        assertThat(converter.htmlToText(html)).isEqualTo("```\nSELECT AVG(embedding) FROM items;\n```\n");
    }

    @Test
    void convertString_snippetDiv_usesClipboardContent() {
        String html = "<p dir=\"auto\">or an Nx tensor with:</p>"
            + "<div class=\"highlight\" data-snippet-clipboard-copy-content=\"vector |&gt; Pgvector.to_tensor()\">"
            + "<pre><span class=\"pl-s1\">vector</span> <span class=\"pl-c1\">|&gt;</span></pre></div>";

        assertThat(converter.htmlToText(html))
            .isEqualTo("or an Nx tensor with:\n\n```\nvector |> Pgvector.to_tensor()\n```\n");
    }

    @Test
    void convertString_divWithTextAndPre_keepsAllParts() {
        String html = """
            <div>
              Intro text
              <pre><code>line1
            line2</code></pre>
              Outro text
            </div>
            """;

        assertThat(converter.htmlToText(html))
            .contains("Intro text")
            .contains("```\nline1\nline2\n```")
            .contains("Outro text");
    }

    @Test
    void convertString_indentedHeading_isTrimmed() {
        String html = """
              <h1 class="Overlay-title " id="custom-scopes-dialog-title">
                Saved searches
              </h1>
            """;

        assertThat(converter.htmlToText(html).strip()).isEqualTo("# Saved searches");
    }

    @Test
    void convertString_linkInListItem_isTrimmed() {
        String html = """
            <ul>
              <li><a href="/pgvector/pgvector/pulls"> Pull requests </a></li>
            </ul>
            """;

        assertThat(converter.htmlToText(html).strip()).isEqualTo("- [Pull requests](/pgvector/pgvector/pulls)");
    }

    @Test
    void convertString_linkTextWithBlankLines_joinsLines() {
        String html = "<p>\n  <a href=\"https://example.com\">\nLine1\n\nLine2\n</a>\n</p>";

        assertThat(converter.htmlToText(html).strip()).isEqualTo("[Line1 Line2](https://example.com)");
    }

    @Test
    void convertString_deeplyNestedMarkup_degradesInsteadOfOverflowing() {
        String html = "<span>".repeat(20_000) + "leaf" + "</span>".repeat(20_000);

        assertThat(converter.htmlToText(html)).isEqualTo("leaf");
    }

    @Test
    void convertFile_deeplyNestedMarkup_keepsFormattingAboveLimit() throws IOException {
        Path file = tempDir.resolve("deep.html");
        Files.writeString(file, "<h1>Top</h1>" + "<div>".repeat(20_000) + "<em>x</em>" + "</div>".repeat(20_000));

        ConversionResult result = converter.convertFile(file, ConverterOptions.defaults());

        assertThat(result.markdown()).isEqualTo("# Top\nx");
    }

    @Test
    void convertString_emptyInput_returnsEmptyMarkdown() {
        ConversionResult result = converter.convertString("");

        assertThat(result.markdown()).isEmpty();
        assertThat(result.title()).isNull();
    }

    @Test
    void convertString_null_throwsException() {
        assertThatThrownBy(() -> converter.convertString(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("html must not be null");
    }

    @Test
    void convert_stream_decodesWithDeclaredCharset() throws IOException {
        byte[] bytes = "<p>café</p>".getBytes(StandardCharsets.ISO_8859_1);
        StreamInfo streamInfo = new StreamInfo("text/html", ".html", "ISO-8859-1", null);

        ConversionResult result = converter.convert(new ByteArrayInputStream(bytes), streamInfo, ConverterOptions.defaults());

        assertThat(result.markdown()).isEqualTo("café\n");
    }

    @Test
    void convertFile_readsFile() throws IOException {
        Path file = tempDir.resolve("page.html");
        Files.writeString(file, "<html><head><title>Page</title></head><body><h2>Section</h2></body></html>");

        ConversionResult result = converter.convertFile(file, ConverterOptions.defaults());

        assertThat(result).isEqualTo(new ConversionResult("## Section\n", "Page"));
    }

    @Test
    void convertFile_spacesAndNewlinesBetweenTags_arePreserved() throws IOException {
        Path file = tempDir.resolve("inline.html");
        Files.writeString(file, "<p><strong>a</strong>   <em>b</em></p>\n<p>c</p>");

        ConversionResult result = converter.convertFile(file, ConverterOptions.defaults());

        assertThat(result.markdown()).isEqualTo("**a**   *b*\n\nc\n");
    }

    @Test
    void convert_unknownCharset_throwsIOException() {
        StreamInfo streamInfo = new StreamInfo("text/html", ".html", "no-such-charset", null);
        ByteArrayInputStream input = new ByteArrayInputStream("<p>x</p>".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> converter.convert(input, streamInfo, ConverterOptions.defaults()))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Unsupported charset: no-such-charset");
    }

    @Test
    void convert_illegalCharsetName_throwsIOException() {
        StreamInfo streamInfo = new StreamInfo("text/html", ".html", "not a charset!", null);
        ByteArrayInputStream input = new ByteArrayInputStream(new byte[0]);

        assertThatThrownBy(() -> converter.convert(input, streamInfo, ConverterOptions.defaults()))
            .isInstanceOf(IOException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void convertFile_missingFile_throwsIOException() {
        assertThatThrownBy(() -> converter.convertFile(tempDir.resolve("missing.html"), ConverterOptions.defaults()))
            .isInstanceOf(IOException.class);
    }

    @Test
    void accepts_matchesHtmlExtensionsAndMimeTypes() {
        assertThat(converter.accepts(StreamInfo.html())).isTrue();
        assertThat(converter.accepts(StreamInfo.forPath(Path.of("docs", "index.HTM")))).isTrue();
        assertThat(converter.accepts(new StreamInfo("application/xhtml+xml", null, null, null))).isTrue();
        assertThat(converter.accepts(new StreamInfo("text/html; charset=utf-8", null, null, null))).isTrue();
        assertThat(converter.accepts(StreamInfo.forPath(Path.of("notes.txt")))).isFalse();
        assertThat(converter.accepts(new StreamInfo(null, null, null, null))).isFalse();
    }
}
