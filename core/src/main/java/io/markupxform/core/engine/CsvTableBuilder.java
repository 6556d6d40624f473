package io.markupxform.core.engine;

import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Builds a table from separator-delimited text. The first line is the header row, every further
 * line a body row.
 *
 * <p>Cells are split on the literal separator, which may be longer than one character. Quoting is
 * not supported. Trailing empty cells are kept and rows are not padded, so a short line yields a
 * short row. An empty line is a row with one empty cell; empty input is an empty header row and
 * no body rows.
 *
 * <p>Thread-safe and immutable.
 */
public final class CsvTableBuilder {

    private final String tableClass;

    /** @param tableClass CSS classes for the generated {@code table} node */
    public CsvTableBuilder(String tableClass) {
        this.tableClass = Objects.requireNonNull(tableClass, "tableClass must not be null");
    }

    /**
     * Builds the table.
     *
     * @param rawText   the block body; lines separated by {@code \n}
     * @param separator the cell separator, must not be empty
     * @return a {@code table} node with a {@code table-header} and a {@code table-body}
     * @throws IllegalArgumentException if the separator is empty
     */
    public DocumentNode build(String rawText, String separator) {
        Objects.requireNonNull(rawText, "rawText must not be null");
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("separator must not be empty");
        }
        Pattern splitter = Pattern.compile(Pattern.quote(separator));
        DocumentNode header = new DocumentNode(NodeTag.TABLE_HEADER);
        DocumentNode body = new DocumentNode(NodeTag.TABLE_BODY);
        if (rawText.isEmpty()) {
            header.append(new DocumentNode(NodeTag.TABLE_ROW));
        } else {
            String[] lines = rawText.split("\n", -1);
            header.append(row(lines[0], splitter));
            for (int i = 1; i < lines.length; i++) {
                body.append(row(lines[i], splitter));
            }
        }

        DocumentNode table = DocumentNode.of(NodeTag.TABLE, header, body);
        if (!tableClass.isEmpty()) {
            table.withClass(tableClass);
        }
        return table;
    }

    private static DocumentNode row(String line, Pattern splitter) {
        DocumentNode row = new DocumentNode(NodeTag.TABLE_ROW);
        for (String cell : splitter.split(line, -1)) {
            row.append(DocumentNode.text(NodeTag.TABLE_CELL, cell));
        }
        return row;
    }
}
