package com.insighthub.report.domain.model;

import java.util.Locale;

/**
 * Discriminator for the {@link ContentBlock} variants.
 */
public enum BlockKind {
    TEXT,
    IMAGE,
    TABLE,
    SPACER,
    RULE,
    PAGE_BREAK;

	/**
	 * Parses a caller supplied block type name.
	 *
	 * @param rawValue name such as {@code "text"} or {@code "page_break"}
	 * @return matching kind or {@code null} when the input cannot be parsed
	 */
    public static BlockKind fromString(String rawValue) {
        if (rawValue == null) {
            return null;
        }
        try {
            return BlockKind.valueOf(rawValue.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
