package com.insighthub.report.domain.model;

/**
 * Embedded raster drawn at a caller supplied size.
 * Height is taken as given; the engine does not inspect image dimensions.
 *
 * @param source handle to the rendered image
 * @param x      left edge override, {@code null} to use the page's left margin
 * @param width  drawn width in points
 * @param height drawn height in points
 */
public record ImageBlock(ImageSource source, Float x, float width, float height) implements ContentBlock {

    public ImageBlock {
        if (source == null) {
            throw new IllegalArgumentException("Image source is required.");
        }
        if (!(width > 0) || !(height > 0)) {
            throw new IllegalArgumentException("Image size must be positive: " + width + "x" + height);
        }
    }

    public static ImageBlock of(ImageSource source, float width, float height) {
        return new ImageBlock(source, null, width, height);
    }

    @Override
    public BlockKind kind() {
        return BlockKind.IMAGE;
    }
}
