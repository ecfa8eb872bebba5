package com.insighthub.report.domain.layout;

import com.insighthub.report.domain.model.LayoutSettings;

/**
 * Vertical write position inside the usable area of the current page.
 * <p>
 * PDF coordinates grow upwards, so the cursor starts at {@code pageHeight - topMargin} and only
 * moves down while content is placed. It never goes below {@code bottomMargin}: an advance that
 * would cross it is refused and leaves the cursor untouched.
 * <p>
 * Consumed height is accumulated in double precision and compared with a small tolerance, so
 * blocks whose heights add up to exactly the usable height still fit on one page.
 */
public final class Cursor {

    static final double TOLERANCE = 1e-3;

    private final float pageHeight;
    private final float topMargin;
    private final float bottomMargin;
    private final float lineHeight;
    private double y;

	/**
	 * Creates a cursor positioned at the top of a fresh page.
	 *
	 * @param pageHeight   physical page height
	 * @param topMargin    space kept free above content
	 * @param bottomMargin space kept free below content
	 * @param lineHeight   default line advance, used for line based queries
	 */
    public Cursor(float pageHeight, float topMargin, float bottomMargin, float lineHeight) {
        if (!(topMargin > 0) || !(bottomMargin > 0) || topMargin + bottomMargin >= pageHeight) {
            throw new IllegalArgumentException("Margins " + topMargin + "/" + bottomMargin
                    + " do not fit a page of height " + pageHeight);
        }
        if (!(lineHeight > 0)) {
            throw new IllegalArgumentException("Line height must be positive: " + lineHeight);
        }
        this.pageHeight = pageHeight;
        this.topMargin = topMargin;
        this.bottomMargin = bottomMargin;
        this.lineHeight = lineHeight;
        this.y = top();
    }

    public static Cursor forSettings(LayoutSettings settings) {
        return new Cursor(settings.pageHeight(), settings.topMargin(), settings.bottomMargin(), settings.lineHeight());
    }

	/**
	 * Reserves {@code height} points below the current position.
	 *
	 * @param height space the content needs, zero or more
	 * @return placement with the top edge to draw at, or an overflow when the content would cross
	 *         the bottom margin
	 */
    public PlacementResult advance(float height) {
        if (height < 0) {
            throw new IllegalArgumentException("Height must not be negative: " + height);
        }
        if (fits(height)) {
            float drawY = (float) y;
            y -= height;
            return PlacementResult.placed(drawY);
        }
        return PlacementResult.overflow();
    }

    public boolean fits(float height) {
        return y - height >= bottomMargin - TOLERANCE;
    }

    /**
     * Moves back to the top of the usable area; called once per new page.
     */
    public void reset() {
        y = top();
    }

    public boolean atTop() {
        return y == top();
    }

    public float y() {
        return (float) y;
    }

    public float top() {
        return pageHeight - topMargin;
    }

    public float bottomMargin() {
        return bottomMargin;
    }

    public float remaining() {
        return (float) Math.max(0d, y - bottomMargin);
    }

    public float usableHeight() {
        return top() - bottomMargin;
    }

    public float lineHeight() {
        return lineHeight;
    }

    public int linesRemaining() {
        return (int) Math.floor((y - bottomMargin + TOLERANCE) / lineHeight);
    }

    @Override
    public String toString() {
        return "Cursor{y=" + y + ", remaining=" + remaining() + "}";
    }
}
