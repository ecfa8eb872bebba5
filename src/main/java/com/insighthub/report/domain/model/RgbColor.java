package com.insighthub.report.domain.model;

import java.util.Locale;

/**
 * Domain value describing an 8-bit RGB color.
 * Colors are compared by value so two styles built from the same hex code are equal.
 */
public record RgbColor(int red, int green, int blue) {

    public static final RgbColor BLACK = new RgbColor(0, 0, 0);

    public RgbColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

	/**
	 * Parses a {@code #RRGGBB} (or {@code RRGGBB}) hex code.
	 *
	 * @param hex color code as used in the report themes
	 * @return parsed color
	 * @throws IllegalArgumentException when the code is not six hex digits
	 */
    public static RgbColor fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Color code is required.");
        }
        String digits = hex.trim();
        if (digits.startsWith("#")) {
            digits = digits.substring(1);
        }
        if (digits.length() != 6) {
            throw new IllegalArgumentException("Expected a #RRGGBB color code but got: " + hex);
        }
        try {
            int value = Integer.parseInt(digits, 16);
            return new RgbColor((value >> 16) & 0xFF, (value >> 8) & 0xFF, value & 0xFF);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Expected a #RRGGBB color code but got: " + hex, ex);
        }
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02X%02X%02X", red, green, blue);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " channel out of range: " + value);
        }
    }
}
