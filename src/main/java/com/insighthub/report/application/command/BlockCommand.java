package com.insighthub.report.application.command;

import java.util.List;

/**
 * Flat, type-tagged description of a content block. Which fields are read depends on
 * {@code type}:
 * <ul>
 *     <li>{@code text}: lines, role, lineHeight, align, x</li>
 *     <li>{@code image}: imagePath, width, height, x</li>
 *     <li>{@code table}: header, rows, columnWidths, rowHeight, x</li>
 *     <li>{@code spacer}: height</li>
 *     <li>{@code rule}: height, color, lineWidth</li>
 *     <li>{@code page_break}: nothing</li>
 * </ul>
 */
public record BlockCommand(
        String type,
        List<String> lines,
        String role,
        Float lineHeight,
        String align,
        String imagePath,
        Float x,
        Float width,
        Float height,
        List<String> header,
        List<List<String>> rows,
        List<Float> columnWidths,
        Float rowHeight,
        String color,
        Float lineWidth
) {

    public static BlockCommand text(String role, List<String> lines) {
        return new BlockCommand("text", lines, role, null, null, null, null, null, null,
                null, null, null, null, null, null);
    }

    public static BlockCommand image(String imagePath, float width, float height) {
        return new BlockCommand("image", null, null, null, null, imagePath, null, width, height,
                null, null, null, null, null, null);
    }

    public static BlockCommand table(List<String> header, List<List<String>> rows, List<Float> columnWidths) {
        return new BlockCommand("table", null, null, null, null, null, null, null, null,
                header, rows, columnWidths, null, null, null);
    }

    public static BlockCommand ofType(String type) {
        return new BlockCommand(type, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null);
    }
}
