package com.insighthub.report.domain.model;

/**
 * Immutable bundle of font name, font size and fill color applied to drawn text.
 * Font names use the PDF Standard 14 vocabulary (for example {@code Helvetica-Bold}).
 */
public record Style(String fontName, float fontSize, RgbColor color) {

    public Style {
        if (fontName == null || fontName.isBlank()) {
            throw new IllegalArgumentException("Font name is required.");
        }
        if (!(fontSize > 0)) {
            throw new IllegalArgumentException("Font size must be positive: " + fontSize);
        }
        if (color == null) {
            color = RgbColor.BLACK;
        }
    }

    public static Style of(String fontName, float fontSize, String hexColor) {
        return new Style(fontName, fontSize, RgbColor.fromHex(hexColor));
    }

    public Style withFontSize(float newSize) {
        return new Style(fontName, newSize, color);
    }
}
