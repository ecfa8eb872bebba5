package com.insighthub.report.infrastructure.pdf;

import com.insighthub.report.domain.exception.InvalidConfigurationException;
import com.insighthub.report.domain.model.Style;

import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves style font names to PDFBox Standard 14 fonts.
 * One instance belongs to one canvas, so fonts are never shared between concurrent renders.
 */
public class PdfFonts {

    private final Map<Standard14Fonts.FontName, PDFont> fonts = new HashMap<>();

	/**
	 * Returns the font for a name such as {@code Helvetica-Oblique}.
	 *
	 * @param fontName Standard 14 font name, case insensitive
	 * @return cached font instance
	 * @throws InvalidConfigurationException when the name is not a Standard 14 font
	 */
    public PDFont resolve(String fontName) {
        Standard14Fonts.FontName name = lookup(fontName)
                .orElseThrow(() -> unsupported(fontName));
        return fonts.computeIfAbsent(name, PDType1Font::new);
    }

    public static boolean isSupported(String fontName) {
        return lookup(fontName).isPresent();
    }

	/**
	 * Fails fast when any of the styles names a font the canvas cannot draw with.
	 *
	 * @param styles styles about to be used in a render
	 * @throws InvalidConfigurationException naming the first unsupported font
	 */
    public static void requireSupported(Collection<Style> styles) {
        for (Style style : styles) {
            if (!isSupported(style.fontName())) {
                throw unsupported(style.fontName());
            }
        }
    }

    private static Optional<Standard14Fonts.FontName> lookup(String fontName) {
        if (fontName == null) {
            return Optional.empty();
        }
        String trimmed = fontName.trim();
        for (Standard14Fonts.FontName name : Standard14Fonts.FontName.values()) {
            if (name.getName().equalsIgnoreCase(trimmed)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    private static InvalidConfigurationException unsupported(String fontName) {
        return new InvalidConfigurationException("Unsupported font '" + fontName
                + "'; use one of the PDF Standard 14 fonts such as Helvetica or Times-Bold.");
    }
}
