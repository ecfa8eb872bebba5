package com.insighthub.report.domain.layout;

import com.insighthub.report.domain.model.ImageSource;
import com.insighthub.report.domain.model.RgbColor;
import com.insighthub.report.domain.model.Style;

import java.io.Closeable;
import java.io.IOException;

/**
 * Drawing surface the layout engine writes pages to.
 * <p>
 * Coordinates are PDF points with the origin at the bottom-left corner of the page. Text state
 * does not survive a page boundary: after {@link #startPage(float, float)} no style is active and
 * {@link #applyStyle(Style)} must be called before any text is drawn. Implementations own their
 * drawing surface and release it in {@link #close()}, whether or not {@link #finish()} ran.
 */
public interface PageCanvas extends Closeable {

    /**
     * Opens a new blank page; subsequent draw calls go to it.
     */
    void startPage(float width, float height) throws IOException;

    /**
     * Sets the font and fill color used by the following text draws on the current page.
     */
    void applyStyle(Style style) throws IOException;

    /**
     * Draws one line of text with its baseline starting at {@code (x, y)}.
     */
    void drawText(float x, float y, String text) throws IOException;

    /**
     * Draws one line of text horizontally centered on {@code centerX}.
     */
    void drawCenteredText(float centerX, float y, String text) throws IOException;

	/**
	 * Draws an image with its lower-left corner at {@code (x, y)}.
	 *
	 * @return {@code false} when the source does not exist and nothing was drawn
	 * @throws IOException when the source exists but cannot be decoded or written
	 */
    boolean drawImage(ImageSource source, float x, float y, float width, float height) throws IOException;

    void drawLine(float x1, float y1, float x2, float y2, RgbColor color, float lineWidth) throws IOException;

    void fillRectangle(float x, float y, float width, float height, RgbColor color) throws IOException;

    void strokeRectangle(float x, float y, float width, float height, RgbColor color, float lineWidth) throws IOException;

    /**
     * Completes the current page. The page cannot be drawn on afterwards.
     */
    void finalizePage() throws IOException;

    /**
     * Flushes every finalized page to the output artifact.
     */
    void finish() throws IOException;
}
