package com.insighthub.report.domain.layout;

import com.insighthub.report.domain.model.LayoutSettings;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the vertical cursor.
 */
class CursorTest {

    private final Cursor cursor = new Cursor(792f, 50f, 50f, 15f);

    @Test
    void startsAtTopOfUsableArea() {
        assertThat(cursor.y()).isEqualTo(742f);
        assertThat(cursor.atTop()).isTrue();
        assertThat(cursor.usableHeight()).isEqualTo(692f);
        assertThat(cursor.linesRemaining()).isEqualTo(46);
    }

    /**
     * Advancing returns the position before the move and lowers the cursor.
     */
    @Test
    void advanceReturnsTopEdgeAndMovesDown() {
        PlacementResult first = cursor.advance(15f);
        PlacementResult second = cursor.advance(30f);

        assertThat(first.fits()).isTrue();
        assertThat(first.drawY()).isEqualTo(742f);
        assertThat(second.drawY()).isEqualTo(727f);
        assertThat(cursor.y()).isEqualTo(697f);
        assertThat(cursor.atTop()).isFalse();
    }

    /**
     * Content exactly as tall as the usable height lands on the bottom margin.
     */
    @Test
    void exactFitReachesBottomMargin() {
        assertThat(cursor.advance(692f).fits()).isTrue();
        assertThat(cursor.y()).isEqualTo(cursor.bottomMargin());
        assertThat(cursor.remaining()).isZero();
    }

    /**
     * An advance crossing the bottom margin is refused and leaves the cursor unchanged.
     */
    @Test
    void overflowLeavesCursorUntouched() {
        cursor.advance(680f);

        PlacementResult result = cursor.advance(13f);

        assertThat(result.fits()).isFalse();
        assertThat(cursor.y()).isEqualTo(62f);
        assertThat(cursor.fits(12f)).isTrue();
    }

    /**
     * Many fractional advances that add up to the usable height still fit.
     */
    @Test
    void fractionalAdvancesAddUpToExactFit() {
        Cursor fractional = new Cursor(504f, 50f, 50f, 10.1f);

        for (int i = 0; i < 40; i++) {
            assertThat(fractional.advance(10.1f).fits()).as("line %d", i).isTrue();
        }
        assertThat(fractional.fits(0.1f)).isFalse();
        assertThat(fractional.linesRemaining()).isZero();
    }

    @Test
    void resetReturnsToTop() {
        cursor.advance(300f);
        cursor.reset();

        assertThat(cursor.atTop()).isTrue();
    }

    @Test
    void rejectsNegativeHeight() {
        assertThrows(IllegalArgumentException.class, () -> cursor.advance(-1f));
    }

    @Test
    void rejectsMarginsLargerThanPage() {
        assertThrows(IllegalArgumentException.class, () -> new Cursor(100f, 50f, 50f, 15f));
    }

    @Test
    void followsLayoutSettings() {
        Cursor fromSettings = Cursor.forSettings(LayoutSettings.builder().margins(72f, 36f, 50f, 50f).build());

        assertThat(fromSettings.top()).isEqualTo(720f);
        assertThat(fromSettings.bottomMargin()).isEqualTo(36f);
    }
}
