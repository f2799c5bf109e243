package com.html2md.core.convert;

import com.html2md.core.node.ElementNode;
import com.html2md.core.node.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Table rendering rules.
 *
 * <p>Produces pipe tables. The header row comes from the first row of {@code thead} and is
 * followed by a {@code ---} separator with one cell per header cell. Body rows come from
 * {@code tbody}, or straight from the table's own {@code tr} children when it has no body
 * wrapper. Anything that is not a cell (inter-cell whitespace, stray elements) is dropped.
 */
class TableFormatter {

    private static final String SEPARATOR_CELL = "---";
    private static final String CELL_DELIMITER = " | ";

    private final MarkdownConverter converter;

    TableFormatter(MarkdownConverter converter) {
        this.converter = converter;
    }

    String table(ElementNode element, ConversionContext context) {
        Optional<ElementNode> head = element.firstChildElement("thead");
        Optional<ElementNode> body = element.firstChildElement("tbody");

        String header = head.map(thead -> converter.convert(thead, context)).orElse("");
        String rows = body.isPresent()
            ? converter.convert(body.get(), context)
            : rows(element, context);

        return "\n\n" + header + rows + "\n";
    }

    /**
     * Renders {@code <thead>}: its first row as header cells, then the separator row.
     */
    String header(ElementNode element, ConversionContext context) {
        Optional<ElementNode> headerRow = element.firstChildElement("tr");
        if (headerRow.isEmpty()) {
            return "";
        }

        int columns = headerRow.get().childElements(ConversionContext.HEADER_CELL).size();
        String row = converter.convert(headerRow.get(), context.withCellTag(ConversionContext.HEADER_CELL));
        String separator = "| " + String.join(CELL_DELIMITER, Collections.nCopies(columns, SEPARATOR_CELL)) + " |\n";
        return row + separator;
    }

    String body(ElementNode element, ConversionContext context) {
        return rows(element, context);
    }

    /**
     * Renders {@code <tr>}. Cells matching the active cell tag, or {@code th}, are kept in
     * document order.
     */
    String row(ElementNode element, ConversionContext context) {
        List<String> cells = new ArrayList<>();
        for (Node child : element.children()) {
            if (child instanceof ElementNode cell && isCell(cell, context)) {
                cells.add(converter.convert(cell, context));
            }
        }
        return "| " + String.join(CELL_DELIMITER, cells) + " |\n";
    }

    String cell(ElementNode element, ConversionContext context) {
        return converter.convert(element.children(), context).strip();
    }

    private String rows(ElementNode parent, ConversionContext context) {
        ConversionContext rowContext = context.withCellTag(ConversionContext.DATA_CELL);
        StringBuilder rows = new StringBuilder();
        for (ElementNode row : parent.childElements("tr")) {
            rows.append(converter.convert(row, rowContext));
        }
        return rows.toString();
    }

    private static boolean isCell(ElementNode element, ConversionContext context) {
        return element.is(context.cellTag()) || element.is(ConversionContext.HEADER_CELL);
    }
}
