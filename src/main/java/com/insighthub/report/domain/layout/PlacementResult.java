package com.insighthub.report.domain.layout;

/**
 * Answer of {@link Cursor#advance(float)}: either the content fits and should be drawn with its
 * top edge at {@code drawY}, or it does not fit on the current page.
 */
public record PlacementResult(boolean fits, float drawY) {

    private static final PlacementResult OVERFLOW = new PlacementResult(false, Float.NaN);

    public static PlacementResult placed(float drawY) {
        return new PlacementResult(true, drawY);
    }

    public static PlacementResult overflow() {
        return OVERFLOW;
    }
}
