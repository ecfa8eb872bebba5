package com.insighthub.report.domain.model;

import com.insighthub.report.domain.exception.InvalidConfigurationException;

/**
 * Page geometry and page decoration shared by every page of a report.
 * All values are in PDF points (1/72 inch) measured from the bottom-left corner of the page.
 * Validation happens here so a bad configuration fails before any page is opened.
 *
 * @param pageWidth                page width
 * @param pageHeight               page height
 * @param topMargin                space kept free above content
 * @param bottomMargin             space kept free below content
 * @param leftMargin               default left edge of content
 * @param rightMargin              space kept free right of content
 * @param footerText               text centered at the bottom of every page, blank for none
 * @param footerOffset             baseline of the footer measured from the page bottom
 * @param continuationHeaderOffset baseline of the continuation header measured from the page top
 * @param continuationText         header drawn on pages that continue a section
 * @param sectionTitleHeight       height consumed by a section title
 * @param lineHeight               default line advance
 */
public record LayoutSettings(
        float pageWidth,
        float pageHeight,
        float topMargin,
        float bottomMargin,
        float leftMargin,
        float rightMargin,
        String footerText,
        float footerOffset,
        float continuationHeaderOffset,
        String continuationText,
        float sectionTitleHeight,
        float lineHeight
) {

    public static final float LETTER_WIDTH = 612f;
    public static final float LETTER_HEIGHT = 792f;
    public static final String DEFAULT_CONTINUATION_TEXT = "Continued Analysis";

    public LayoutSettings {
        requirePositive("Page width", pageWidth);
        requirePositive("Page height", pageHeight);
        requirePositive("Top margin", topMargin);
        requirePositive("Bottom margin", bottomMargin);
        requirePositive("Left margin", leftMargin);
        requirePositive("Right margin", rightMargin);
        requirePositive("Section title height", sectionTitleHeight);
        requirePositive("Line height", lineHeight);
        if (topMargin + bottomMargin >= pageHeight) {
            throw new InvalidConfigurationException("Top and bottom margins (" + topMargin + " + " + bottomMargin
                    + ") leave no room on a page of height " + pageHeight + ".");
        }
        if (leftMargin + rightMargin >= pageWidth) {
            throw new InvalidConfigurationException("Left and right margins (" + leftMargin + " + " + rightMargin
                    + ") leave no room on a page of width " + pageWidth + ".");
        }
        if (!(footerOffset > 0) || footerOffset >= bottomMargin) {
            throw new InvalidConfigurationException("Footer offset must lie inside the bottom margin (0, "
                    + bottomMargin + "): " + footerOffset);
        }
        if (!(continuationHeaderOffset > 0) || continuationHeaderOffset >= topMargin) {
            throw new InvalidConfigurationException("Continuation header offset must lie inside the top margin (0, "
                    + topMargin + "): " + continuationHeaderOffset);
        }
        if (sectionTitleHeight > pageHeight - topMargin - bottomMargin) {
            throw new InvalidConfigurationException("Section title height " + sectionTitleHeight
                    + " exceeds the usable page height.");
        }
        footerText = footerText == null ? "" : footerText;
        continuationText = continuationText == null || continuationText.isBlank()
                ? DEFAULT_CONTINUATION_TEXT
                : continuationText;
    }

	/**
	 * Letter sized pages with the margins used throughout the analysis reports.
	 *
	 * @param footerText footer drawn on every page
	 * @return settings for 612x792 pages with 50pt margins
	 */
    public static LayoutSettings letter(String footerText) {
        return builder().footerText(footerText).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public float usableHeight() {
        return pageHeight - topMargin - bottomMargin;
    }

    public float contentWidth() {
        return pageWidth - leftMargin - rightMargin;
    }

    public float contentTop() {
        return pageHeight - topMargin;
    }

    private static void requirePositive(String name, float value) {
        if (!(value > 0)) {
            throw new InvalidConfigurationException(name + " must be positive: " + value);
        }
    }

    /**
     * Fluent builder starting from the Letter defaults.
     */
    public static final class Builder {
        private float pageWidth = LETTER_WIDTH;
        private float pageHeight = LETTER_HEIGHT;
        private float topMargin = 50f;
        private float bottomMargin = 50f;
        private float leftMargin = 50f;
        private float rightMargin = 50f;
        private String footerText = "";
        private float footerOffset = 20f;
        private float continuationHeaderOffset = 30f;
        private String continuationText = DEFAULT_CONTINUATION_TEXT;
        private float sectionTitleHeight = 30f;
        private float lineHeight = 15f;

        private Builder() {
        }

        public Builder pageSize(float width, float height) {
            this.pageWidth = width;
            this.pageHeight = height;
            return this;
        }

        public Builder margins(float top, float bottom, float left, float right) {
            this.topMargin = top;
            this.bottomMargin = bottom;
            this.leftMargin = left;
            this.rightMargin = right;
            return this;
        }

        public Builder footerText(String footerText) {
            this.footerText = footerText;
            return this;
        }

        public Builder footerOffset(float footerOffset) {
            this.footerOffset = footerOffset;
            return this;
        }

        public Builder continuationHeader(String text, float offset) {
            this.continuationText = text;
            this.continuationHeaderOffset = offset;
            return this;
        }

        public Builder sectionTitleHeight(float sectionTitleHeight) {
            this.sectionTitleHeight = sectionTitleHeight;
            return this;
        }

        public Builder lineHeight(float lineHeight) {
            this.lineHeight = lineHeight;
            return this;
        }

        public LayoutSettings build() {
            return new LayoutSettings(pageWidth, pageHeight, topMargin, bottomMargin, leftMargin, rightMargin,
                    footerText, footerOffset, continuationHeaderOffset, continuationText, sectionTitleHeight,
                    lineHeight);
        }
    }
}
