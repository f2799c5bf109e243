package com.html2md.core.html;

import com.html2md.core.config.ConverterOptions;
import com.html2md.core.convert.MarkdownConverter;
import com.html2md.core.node.ElementNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Converts HTML documents to Markdown.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Encode whitespace between tags so the parser keeps it</li>
 *   <li>Parse with jsoup as a full document, falling back to a body fragment</li>
 *   <li>Remove {@code script} and {@code style} elements</li>
 *   <li>Extract the title: {@code <title>} first, {@code og:title} meta tag second</li>
 *   <li>Render the {@code body} (or the whole document) with {@link MarkdownConverter}</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HtmlDocumentConverter converter = new HtmlDocumentConverter();
 *
 * ConversionResult result = converter.convertString("<h1>Hello World</h1>");
 * result.markdown();  // "# Hello World\n"
 * result.title();     // null
 *
 * ConversionResult page = converter.convertFile(Paths.get("page.html"), ConverterOptions.defaults());
 * }</pre>
 */
public class HtmlDocumentConverter implements DocumentConverter {

    private static final Logger log = LoggerFactory.getLogger(HtmlDocumentConverter.class);

    private static final List<String> ACCEPTED_MIME_TYPE_PREFIXES = List.of("text/html", "application/xhtml");
    private static final List<String> ACCEPTED_FILE_EXTENSIONS = List.of(".html", ".htm");

    private static final String OPEN_GRAPH_TITLE = "meta[property=og:title]";

    private final MarkdownConverter markdownConverter;

    public HtmlDocumentConverter() {
        this(new MarkdownConverter());
    }

    public HtmlDocumentConverter(MarkdownConverter markdownConverter) {
        this.markdownConverter = Objects.requireNonNull(markdownConverter, "markdownConverter must not be null");
    }

    @Override
    public boolean accepts(StreamInfo streamInfo) {
        String mimetype = streamInfo.mimetype() == null ? "" : streamInfo.mimetype().toLowerCase(Locale.ROOT);
        String extension = streamInfo.extension() == null ? "" : streamInfo.extension().toLowerCase(Locale.ROOT);

        return ACCEPTED_FILE_EXTENSIONS.contains(extension)
            || ACCEPTED_MIME_TYPE_PREFIXES.stream().anyMatch(mimetype::startsWith);
    }

    @Override
    public ConversionResult convert(InputStream input, StreamInfo streamInfo, ConverterOptions options) throws IOException {
        String html = new String(input.readAllBytes(), streamInfo.resolveCharset());
        return convertHtml(html, options);
    }

    /**
     * Converts an HTML string with default options.
     *
     * @param html HTML document or fragment
     * @return converted Markdown and title
     */
    public ConversionResult convertString(String html) {
        return convertString(html, ConverterOptions.defaults());
    }

    /**
     * Converts an HTML string.
     *
     * @param html HTML document or fragment
     * @param options conversion settings
     * @return converted Markdown and title
     */
    public ConversionResult convertString(String html, ConverterOptions options) {
        return convertHtml(html, options);
    }

    /**
     * Reads and converts an HTML file.
     *
     * @param path HTML file
     * @param options conversion settings
     * @return converted Markdown and title
     * @throws IOException if the file cannot be read
     */
    public ConversionResult convertFile(Path path, ConverterOptions options) throws IOException {
        log.info("Converting file: {}", path);
        StreamInfo streamInfo = StreamInfo.forPath(path);
        if (!accepts(streamInfo)) {
            log.warn("File does not look like HTML, converting anyway: {}", path);
        }
        try (InputStream input = Files.newInputStream(path)) {
            return convert(input, streamInfo, options);
        }
    }

    /**
     * Converts HTML and returns only the Markdown text.
     *
     * @param html HTML document or fragment
     * @return Markdown text
     */
    public String htmlToText(String html) {
        return convertString(html).markdown();
    }

    private ConversionResult convertHtml(String html, ConverterOptions options) {
        Objects.requireNonNull(html, "html must not be null");
        Objects.requireNonNull(options, "options must not be null");

        Document document = parse(HtmlPreprocessor.preserveInterTagWhitespace(html));
        document.select("script, style").remove();

        String title = findTitle(document);
        Element content = document.body() != null ? document.body() : document;
        ElementNode tree = JsoupNodeAdapter.adapt(content);

        String markdown = markdownConverter.convertDocument(tree, options);
        log.debug("Converted {} characters of HTML to {} characters of Markdown", html.length(), markdown.length());
        return new ConversionResult(markdown, title);
    }

    private Document parse(String html) {
        try {
            return Jsoup.parse(html);
        } catch (RuntimeException e) {
            log.warn("Document parsing failed, retrying as a fragment: {}", e.getMessage());
            return Jsoup.parseBodyFragment(html);
        }
    }

    private String findTitle(Document document) {
        Element title = document.selectFirst("title");
        if (title != null) {
            return title.text();
        }

        Element openGraphTitle = document.selectFirst(OPEN_GRAPH_TITLE);
        if (openGraphTitle != null && openGraphTitle.hasAttr("content")) {
            return openGraphTitle.attr("content");
        }
        return null;
    }
}
