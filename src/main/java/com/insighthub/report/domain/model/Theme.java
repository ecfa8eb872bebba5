package com.insighthub.report.domain.model;

import com.insighthub.report.domain.exception.InvalidConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapping from a presentation role to the {@link Style} drawn for it.
 * The layout engine only ever looks styles up by role, so a theme must define every role in
 * {@link #REQUIRED_ROLES}; this is checked when the theme is built.
 */
public record Theme(Map<String, Style> styles) {

    public static final String TITLE = "title";
    public static final String SUBTITLE = "subtitle";
    public static final String HEADING = "heading";
    public static final String BODY = "body";
    public static final String FOOTER = "footer";
    public static final String CAPTION = "caption";
    public static final String TABLE_HEADER = "tableHeader";
    public static final String TABLE_BODY = "tableBody";

    public static final List<String> REQUIRED_ROLES = List.of(
            HEADING, BODY, FOOTER, CAPTION, TABLE_HEADER, TABLE_BODY);

    public Theme {
        if (styles == null || styles.isEmpty()) {
            throw new InvalidConfigurationException("Theme must define at least the roles " + REQUIRED_ROLES + ".");
        }
        for (String role : REQUIRED_ROLES) {
            if (styles.get(role) == null) {
                throw new InvalidConfigurationException("Theme is missing the '" + role + "' role.");
            }
        }
        styles = Collections.unmodifiableMap(new LinkedHashMap<>(styles));
    }

	/**
	 * Built-in theme matching the look of the Insight Hub analysis reports.
	 *
	 * @return theme covering every known role
	 */
    public static Theme defaultTheme() {
        Map<String, Style> styles = new LinkedHashMap<>();
        styles.put(TITLE, Style.of("Helvetica-Bold", 24, "#2E86AB"));
        styles.put(SUBTITLE, Style.of("Helvetica", 16, "#A23B72"));
        styles.put(HEADING, Style.of("Helvetica-Bold", 16, "#2E86AB"));
        styles.put(BODY, Style.of("Helvetica", 10, "#333333"));
        styles.put(FOOTER, Style.of("Helvetica-Oblique", 8, "#666666"));
        styles.put(CAPTION, Style.of("Helvetica", 10, "#666666"));
        styles.put(TABLE_HEADER, Style.of("Helvetica-Bold", 10, "#F5F5F5"));
        styles.put(TABLE_BODY, Style.of("Helvetica", 9, "#000000"));
        return new Theme(styles);
    }

	/**
	 * Returns a copy of this theme where the given styles replace (or add to) the existing roles.
	 *
	 * @param overrides role to style replacements, may be empty
	 * @return merged theme
	 */
    public Theme merge(Map<String, Style> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, Style> merged = new LinkedHashMap<>(styles);
        merged.putAll(overrides);
        return new Theme(merged);
    }

	/**
	 * Looks up the style for a role.
	 *
	 * @param role role name such as {@link #BODY}
	 * @return style registered for the role
	 * @throws InvalidConfigurationException when the role is unknown to this theme
	 */
    public Style style(String role) {
        Style style = styles.get(role);
        if (style == null) {
            throw new InvalidConfigurationException("Theme is missing the '" + role + "' role.");
        }
        return style;
    }

    public boolean hasRole(String role) {
        return styles.containsKey(role);
    }
}
