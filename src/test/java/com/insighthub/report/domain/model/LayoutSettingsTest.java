package com.insighthub.report.domain.model;

import com.insighthub.report.domain.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for page geometry validation.
 */
class LayoutSettingsTest {

    @Test
    void letterDefaults() {
        LayoutSettings settings = LayoutSettings.letter("Generated by Insight Hub");

        assertThat(settings.pageWidth()).isEqualTo(612f);
        assertThat(settings.pageHeight()).isEqualTo(792f);
        assertThat(settings.usableHeight()).isEqualTo(692f);
        assertThat(settings.contentWidth()).isEqualTo(512f);
        assertThat(settings.contentTop()).isEqualTo(742f);
        assertThat(settings.footerOffset()).isEqualTo(20f);
        assertThat(settings.continuationText()).isEqualTo("Continued Analysis");
    }

    /**
     * Margins that leave no usable area are a configuration error.
     */
    @Test
    void rejectsMarginsExceedingPage() {
        assertThrows(InvalidConfigurationException.class,
                () -> LayoutSettings.builder().pageSize(612f, 100f).build());
        assertThrows(InvalidConfigurationException.class,
                () -> LayoutSettings.builder().margins(50f, 50f, 306f, 306f).build());
    }

    @Test
    void rejectsNonPositiveDimensions() {
        assertThrows(InvalidConfigurationException.class,
                () -> LayoutSettings.builder().pageSize(0f, 792f).build());
        assertThrows(InvalidConfigurationException.class,
                () -> LayoutSettings.builder().lineHeight(-1f).build());
    }

    /**
     * Footer and continuation header must be drawn inside their margins.
     */
    @Test
    void rejectsDecorationOutsideMargins() {
        assertThrows(InvalidConfigurationException.class,
                () -> LayoutSettings.builder().footerOffset(60f).build());
        assertThrows(InvalidConfigurationException.class,
                () -> LayoutSettings.builder().continuationHeader("More", 50f).build());
    }

    @Test
    void normalizesMissingTexts() {
        LayoutSettings settings = LayoutSettings.builder()
                .footerText(null)
                .continuationHeader(" ", 30f)
                .build();

        assertThat(settings.footerText()).isEmpty();
        assertThat(settings.continuationText()).isEqualTo(LayoutSettings.DEFAULT_CONTINUATION_TEXT);
    }
}
