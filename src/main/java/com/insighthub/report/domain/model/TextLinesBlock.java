package com.insighthub.report.domain.model;

import java.util.List;

/**
 * Pre-wrapped lines of text drawn in a single style.
 * The block is atomic: it is never split across a page break.
 *
 * @param lines      lines in drawing order, already wrapped by the caller
 * @param style      style every line is drawn with
 * @param lineHeight vertical advance per line in points
 * @param x          left edge override, {@code null} to use the page's left margin
 * @param alignment  horizontal placement of each line
 */
public record TextLinesBlock(
        List<String> lines,
        Style style,
        float lineHeight,
        Float x,
        TextAlignment alignment
) implements ContentBlock {

    public TextLinesBlock {
        if (lines == null) {
            throw new IllegalArgumentException("Text block lines are required.");
        }
        if (style == null) {
            throw new IllegalArgumentException("Text block style is required.");
        }
        if (!(lineHeight > 0)) {
            throw new IllegalArgumentException("Line height must be positive: " + lineHeight);
        }
        lines = lines.stream().map(line -> line == null ? "" : line).toList();
        alignment = alignment == null ? TextAlignment.LEFT : alignment;
    }

    public static TextLinesBlock of(List<String> lines, Style style, float lineHeight) {
        return new TextLinesBlock(lines, style, lineHeight, null, TextAlignment.LEFT);
    }

    public static TextLinesBlock centered(List<String> lines, Style style, float lineHeight) {
        return new TextLinesBlock(lines, style, lineHeight, null, TextAlignment.CENTER);
    }

    @Override
    public BlockKind kind() {
        return BlockKind.TEXT;
    }

    @Override
    public float height() {
        return lines.size() * lineHeight;
    }
}
