package com.insighthub.report.domain.model;

/**
 * Horizontal placement of each line of a {@link TextLinesBlock}.
 */
public enum TextAlignment {
    LEFT,
    CENTER
}
