package com.insighthub.report.domain.model;

import java.util.List;

/**
 * Simple grid of text cells with fixed column widths and a fixed row height.
 * Unlike text and images a table may span pages: rows are placed one by one and the header
 * row, when present, is repeated at the top of every page the table continues on.
 *
 * @param header       header cells, empty when the table has no header row
 * @param rows         data rows; a row may have fewer cells than columns
 * @param columnWidths width of every column in points
 * @param rowHeight    height of every row, header included
 * @param x            left edge override, {@code null} to use the page's left margin
 * @param headerFill   background of the header row
 * @param gridColor    color of the cell borders
 */
public record TableBlock(
        List<String> header,
        List<List<String>> rows,
        List<Float> columnWidths,
        float rowHeight,
        Float x,
        RgbColor headerFill,
        RgbColor gridColor
) implements ContentBlock {

    public static final RgbColor DEFAULT_HEADER_FILL = new RgbColor(128, 128, 128);
    public static final RgbColor DEFAULT_GRID_COLOR = RgbColor.BLACK;

    public TableBlock {
        if (columnWidths == null || columnWidths.isEmpty()) {
            throw new IllegalArgumentException("Table needs at least one column width.");
        }
        for (Float width : columnWidths) {
            if (width == null || !(width > 0)) {
                throw new IllegalArgumentException("Column widths must be positive: " + columnWidths);
            }
        }
        if (!(rowHeight > 0)) {
            throw new IllegalArgumentException("Row height must be positive: " + rowHeight);
        }
        header = header == null ? List.of() : List.copyOf(header);
        if (header.size() > columnWidths.size()) {
            throw new IllegalArgumentException("Header has " + header.size() + " cells but only "
                    + columnWidths.size() + " columns are defined.");
        }
        rows = rows == null ? List.of() : rows.stream()
                .map(row -> row == null ? List.<String>of() : row.stream().map(cell -> cell == null ? "" : cell).toList())
                .toList();
        for (List<String> row : rows) {
            if (row.size() > columnWidths.size()) {
                throw new IllegalArgumentException("Row has " + row.size() + " cells but only "
                        + columnWidths.size() + " columns are defined.");
            }
        }
        columnWidths = List.copyOf(columnWidths);
        headerFill = headerFill == null ? DEFAULT_HEADER_FILL : headerFill;
        gridColor = gridColor == null ? DEFAULT_GRID_COLOR : gridColor;
    }

    public static TableBlock of(List<String> header, List<List<String>> rows, List<Float> columnWidths, float rowHeight) {
        return new TableBlock(header, rows, columnWidths, rowHeight, null, null, null);
    }

    public boolean hasHeader() {
        return !header.isEmpty();
    }

    public float totalWidth() {
        float total = 0f;
        for (Float width : columnWidths) {
            total += width;
        }
        return total;
    }

    @Override
    public BlockKind kind() {
        return BlockKind.TABLE;
    }

    @Override
    public float height() {
        return (rows.size() + (hasHeader() ? 1 : 0)) * rowHeight;
    }
}
