package com.insighthub.report.infrastructure.config;

import com.insighthub.report.domain.exception.InvalidConfigurationException;
import com.insighthub.report.domain.model.LayoutSettings;
import com.insighthub.report.domain.model.RgbColor;
import com.insighthub.report.domain.model.Style;
import com.insighthub.report.domain.model.Theme;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Report layout configuration bound from {@code report.layout.*}.
 * Defaults describe Letter pages with 50pt margins; theme entries override the built-in theme
 * role by role.
 */
@Component
@ConfigurationProperties(prefix = "report.layout")
public class ReportLayoutProperties {

    private float pageWidth = LayoutSettings.LETTER_WIDTH;
    private float pageHeight = LayoutSettings.LETTER_HEIGHT;
    private float topMargin = 50f;
    private float bottomMargin = 50f;
    private float leftMargin = 50f;
    private float rightMargin = 50f;
    private String footerText = "";
    private float footerOffset = 20f;
    private float continuationHeaderOffset = 30f;
    private String continuationText = LayoutSettings.DEFAULT_CONTINUATION_TEXT;
    private float sectionTitleHeight = 30f;
    private float lineHeight = 15f;
    private String creator = "Insight Hub";
    private final Map<String, StyleProperties> theme = new LinkedHashMap<>();

    /**
     * Builds validated layout settings from the bound values.
     *
     * @return settings for new documents
     */
    public LayoutSettings toSettings() {
        return new LayoutSettings(pageWidth, pageHeight, topMargin, bottomMargin, leftMargin, rightMargin,
                footerText, footerOffset, continuationHeaderOffset, continuationText, sectionTitleHeight, lineHeight);
    }

    /**
     * Builds the theme: the built-in roles with the configured overrides applied.
     *
     * @return merged theme
     */
    public Theme toTheme() {
        Theme defaults = Theme.defaultTheme();
        Map<String, Style> overrides = new LinkedHashMap<>();
        theme.forEach((role, properties) -> {
            Style fallback = defaults.hasRole(role) ? defaults.style(role) : defaults.style(Theme.BODY);
            try {
                overrides.put(role, properties.toStyle(fallback));
            } catch (IllegalArgumentException ex) {
                throw new InvalidConfigurationException("Invalid style for theme role '" + role + "': " + ex.getMessage());
            }
        });
        return defaults.merge(overrides);
    }

    public float getPageWidth() {
        return pageWidth;
    }

    public void setPageWidth(float pageWidth) {
        this.pageWidth = pageWidth;
    }

    public float getPageHeight() {
        return pageHeight;
    }

    public void setPageHeight(float pageHeight) {
        this.pageHeight = pageHeight;
    }

    public float getTopMargin() {
        return topMargin;
    }

    public void setTopMargin(float topMargin) {
        this.topMargin = topMargin;
    }

    public float getBottomMargin() {
        return bottomMargin;
    }

    public void setBottomMargin(float bottomMargin) {
        this.bottomMargin = bottomMargin;
    }

    public float getLeftMargin() {
        return leftMargin;
    }

    public void setLeftMargin(float leftMargin) {
        this.leftMargin = leftMargin;
    }

    public float getRightMargin() {
        return rightMargin;
    }

    public void setRightMargin(float rightMargin) {
        this.rightMargin = rightMargin;
    }

    public String getFooterText() {
        return footerText;
    }

    public void setFooterText(String footerText) {
        this.footerText = footerText;
    }

    public float getFooterOffset() {
        return footerOffset;
    }

    public void setFooterOffset(float footerOffset) {
        this.footerOffset = footerOffset;
    }

    public float getContinuationHeaderOffset() {
        return continuationHeaderOffset;
    }

    public void setContinuationHeaderOffset(float continuationHeaderOffset) {
        this.continuationHeaderOffset = continuationHeaderOffset;
    }

    public String getContinuationText() {
        return continuationText;
    }

    public void setContinuationText(String continuationText) {
        this.continuationText = continuationText;
    }

    public float getSectionTitleHeight() {
        return sectionTitleHeight;
    }

    public void setSectionTitleHeight(float sectionTitleHeight) {
        this.sectionTitleHeight = sectionTitleHeight;
    }

    public float getLineHeight() {
        return lineHeight;
    }

    public void setLineHeight(float lineHeight) {
        this.lineHeight = lineHeight;
    }

    public String getCreator() {
        return creator;
    }

    public void setCreator(String creator) {
        this.creator = creator;
    }

    public Map<String, StyleProperties> getTheme() {
        return theme;
    }

    /**
     * Style override for one theme role. Unset fields keep the role's built-in value.
     */
    public static class StyleProperties {
        private String font;
        private Float size;
        private String color;

        Style toStyle(Style fallback) {
            return new Style(
                    font != null ? font : fallback.fontName(),
                    size != null ? size : fallback.fontSize(),
                    color != null ? RgbColor.fromHex(color) : fallback.color());
        }

        public String getFont() {
            return font;
        }

        public void setFont(String font) {
            this.font = font;
        }

        public Float getSize() {
            return size;
        }

        public void setSize(Float size) {
            this.size = size;
        }

        public String getColor() {
            return color;
        }

        public void setColor(String color) {
            this.color = color;
        }
    }
}
