package com.insighthub.report.domain.layout;

import com.insighthub.report.domain.exception.BlockTooLargeException;
import com.insighthub.report.domain.model.BlockPlacement;
import com.insighthub.report.domain.model.ContentBlock;
import com.insighthub.report.domain.model.ImageBlock;
import com.insighthub.report.domain.model.LayoutResult;
import com.insighthub.report.domain.model.LayoutSettings;
import com.insighthub.report.domain.model.RgbColor;
import com.insighthub.report.domain.model.RuleBlock;
import com.insighthub.report.domain.model.Section;
import com.insighthub.report.domain.model.Style;
import com.insighthub.report.domain.model.TableBlock;
import com.insighthub.report.domain.model.TextAlignment;
import com.insighthub.report.domain.model.TextLinesBlock;
import com.insighthub.report.domain.model.Theme;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Flows report sections onto fixed-size pages.
 * <p>
 * Text, image and rule blocks are atomic: when one does not fit the remaining space the page is
 * finalized (footer drawn), a new page is opened and the block is retried once. A block that
 * still does not fit can never fit and aborts the render with {@link BlockTooLargeException}.
 * Tables are placed row by row and repeat their header on every page they continue on.
 * <p>
 * An engine owns the cursor and the active text style of exactly one render and must not be
 * reused. The active style is re-applied to the canvas right after every page is opened, before
 * the continuation header or any resumed content is drawn.
 */
public class LayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);
    private static final float CELL_PADDING = 4f;
    private static final float GRID_LINE_WIDTH = 0.5f;
    private static final RgbColor PLACEHOLDER_FILL = RgbColor.fromHex("#CCCCCC");
    private static final String PLACEHOLDER_PREFIX = "Image not available: ";

    private final LayoutSettings settings;
    private final Theme theme;
    private final PageCanvas canvas;
    private final Cursor cursor;
    private final List<BlockPlacement> placements = new ArrayList<>();

    private Style activeStyle;
    private int pageNumber;
    private boolean used;

	/**
	 * Creates an engine for a single render.
	 *
	 * @param settings page geometry and decoration
	 * @param theme    styles for headings, footer, captions and tables
	 * @param canvas   surface receiving the pages
	 */
    public LayoutEngine(LayoutSettings settings, Theme theme, PageCanvas canvas) {
        if (settings == null || theme == null || canvas == null) {
            throw new IllegalArgumentException("Settings, theme and canvas are required.");
        }
        this.settings = settings;
        this.theme = theme;
        this.canvas = canvas;
        this.cursor = Cursor.forSettings(settings);
        this.activeStyle = theme.style(Theme.BODY);
    }

	/**
	 * Places every section in order and flushes the canvas.
	 *
	 * @param sections sections in report order
	 * @return page count and placement of every unit of content
	 * @throws BlockTooLargeException when a block cannot fit on an empty page
	 * @throws IOException            when the canvas fails to draw or write
	 */
    public LayoutResult render(List<Section> sections) throws IOException {
        if (used) {
            throw new IllegalStateException("A LayoutEngine renders a single report; create a new one.");
        }
        used = true;

        openPage();
        for (int sectionIndex = 0; sectionIndex < sections.size(); sectionIndex++) {
            placeSection(sectionIndex, sections.get(sectionIndex));
        }
        finalizePage();
        canvas.finish();

        log.info("Laid out {} section(s) on {} page(s)", sections.size(), pageNumber);
        return new LayoutResult(pageNumber, placements);
    }

    Style activeStyle() {
        return activeStyle;
    }

    private void placeSection(int sectionIndex, Section section) throws IOException {
        if (section.startOnNewPage() && !cursor.atTop()) {
            breakPage(section, false);
        }
        if (section.hasTitle()) {
            placeSectionTitle(sectionIndex, section);
        }
        List<ContentBlock> blocks = section.blocks();
        for (int blockIndex = 0; blockIndex < blocks.size(); blockIndex++) {
            placeBlock(sectionIndex, section, blockIndex, blocks.get(blockIndex));
        }
    }

    private void placeSectionTitle(int sectionIndex, Section section) throws IOException {
        float titleHeight = settings.sectionTitleHeight();
        float keepWithNext = titleHeight + leadingHeight(section);
        // a heading is not left alone at the bottom of a page when its first block fits a fresh one
        if (!cursor.atTop() && !cursor.fits(keepWithNext) && keepWithNext <= cursor.usableHeight()) {
            breakPage(section, false);
        }
        PlacementResult result = cursor.advance(titleHeight);
        if (!result.fits()) {
            breakPage(section, false);
            result = cursor.advance(titleHeight);
        }
        Style heading = theme.style(Theme.HEADING);
        canvas.applyStyle(heading);
        canvas.drawText(settings.leftMargin(), baseline(result.drawY(), titleHeight, heading), section.title());
        canvas.applyStyle(activeStyle);
        record(sectionIndex, -1, -1, BlockPlacement.Part.SECTION_TITLE, settings.leftMargin(), result.drawY(), titleHeight);
    }

    private float leadingHeight(Section section) {
        if (section.blocks().isEmpty()) {
            return 0f;
        }
        ContentBlock first = section.blocks().get(0);
        if (first instanceof TableBlock table) {
            return tableLeadHeight(table);
        }
        return switch (first.kind()) {
            case TEXT, IMAGE, RULE -> first.height();
            default -> 0f;
        };
    }

    private void placeBlock(int sectionIndex, Section section, int blockIndex, ContentBlock block) throws IOException {
        switch (block.kind()) {
            case TEXT, IMAGE, RULE -> placeAtomic(sectionIndex, section, blockIndex, block);
            case TABLE -> placeTable(sectionIndex, section, blockIndex, (TableBlock) block);
            case SPACER -> {
                if (!cursor.advance(block.height()).fits()) {
                    log.debug("Dropping spacer {} of section {} at page bottom", blockIndex, sectionIndex);
                }
            }
            case PAGE_BREAK -> {
                if (!cursor.atTop()) {
                    breakPage(section, true);
                }
            }
        }
    }

    private void placeAtomic(int sectionIndex, Section section, int blockIndex, ContentBlock block) throws IOException {
        float height = block.height();
        PlacementResult result = cursor.advance(height);
        if (!result.fits()) {
            if (cursor.atTop()) {
                throw tooLarge(sectionIndex, section, blockIndex, height);
            }
            breakPage(section, true);
            result = cursor.advance(height);
            if (!result.fits()) {
                throw tooLarge(sectionIndex, section, blockIndex, height);
            }
        }

        float x;
        if (block instanceof TextLinesBlock text) {
            x = leftEdge(text.x());
            drawTextLines(text, x, result.drawY());
        } else if (block instanceof ImageBlock image) {
            x = leftEdge(image.x());
            drawImage(image, x, result.drawY());
        } else if (block instanceof RuleBlock rule) {
            x = settings.leftMargin();
            float lineY = result.drawY() - rule.height() / 2f;
            canvas.drawLine(x, lineY, settings.pageWidth() - settings.rightMargin(), lineY, rule.color(), rule.lineWidth());
        } else {
            throw new IllegalArgumentException("Unsupported block type: " + block.getClass().getName());
        }
        record(sectionIndex, blockIndex, -1, BlockPlacement.Part.BLOCK, x, result.drawY(), height);
    }

    private void drawTextLines(TextLinesBlock block, float x, float top) throws IOException {
        activeStyle = block.style();
        canvas.applyStyle(activeStyle);
        float lineHeight = block.lineHeight();
        float centerX = (x + settings.pageWidth() - settings.rightMargin()) / 2f;
        List<String> lines = block.lines();
        for (int i = 0; i < lines.size(); i++) {
            float y = baseline(top - i * lineHeight, lineHeight, activeStyle);
            if (block.alignment() == TextAlignment.CENTER) {
                canvas.drawCenteredText(centerX, y, lines.get(i));
            } else {
                canvas.drawText(x, y, lines.get(i));
            }
        }
    }

    private void drawImage(ImageBlock block, float x, float top) throws IOException {
        float bottom = top - block.height();
        if (canvas.drawImage(block.source(), x, bottom, block.width(), block.height())) {
            return;
        }
        log.warn("Image {} not found, drawing placeholder", block.source().path());
        canvas.fillRectangle(x, bottom, block.width(), block.height(), PLACEHOLDER_FILL);
        canvas.applyStyle(theme.style(Theme.CAPTION));
        canvas.drawCenteredText(x + block.width() / 2f, bottom + block.height() / 2f,
                PLACEHOLDER_PREFIX + block.source().displayName());
        canvas.applyStyle(activeStyle);
    }

    private void placeTable(int sectionIndex, Section section, int blockIndex, TableBlock table) throws IOException {
        float rowHeight = table.rowHeight();
        float lead = tableLeadHeight(table);
        if (lead > cursor.usableHeight()) {
            throw tooLarge(sectionIndex, section, blockIndex, lead);
        }
        if (!cursor.fits(lead)) {
            breakPage(section, true);
        }

        float x = leftEdge(table.x());
        if (table.hasHeader()) {
            drawTableHeader(sectionIndex, blockIndex, table, x);
        }
        Style bodyStyle = theme.style(Theme.TABLE_BODY);
        List<List<String>> rows = table.rows();
        for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
            PlacementResult result = cursor.advance(rowHeight);
            if (!result.fits()) {
                log.debug("Table {} of section {} continues on a new page at row {}", blockIndex, sectionIndex, rowIndex);
                breakPage(section, true);
                if (table.hasHeader()) {
                    drawTableHeader(sectionIndex, blockIndex, table, x);
                }
                result = cursor.advance(rowHeight);
            }
            drawCells(table, rows.get(rowIndex), bodyStyle, x, result.drawY());
            record(sectionIndex, blockIndex, rowIndex, BlockPlacement.Part.TABLE_ROW, x, result.drawY(), rowHeight);
        }
        canvas.applyStyle(activeStyle);
    }

    private float tableLeadHeight(TableBlock table) {
        float headerHeight = table.hasHeader() ? table.rowHeight() : 0f;
        return headerHeight + (table.rows().isEmpty() ? 0f : table.rowHeight());
    }

    private void drawTableHeader(int sectionIndex, int blockIndex, TableBlock table, float x) throws IOException {
        PlacementResult result = cursor.advance(table.rowHeight());
        float top = result.drawY();
        canvas.fillRectangle(x, top - table.rowHeight(), table.totalWidth(), table.rowHeight(), table.headerFill());
        drawCells(table, table.header(), theme.style(Theme.TABLE_HEADER), x, top);
        record(sectionIndex, blockIndex, -1, BlockPlacement.Part.TABLE_HEADER, x, top, table.rowHeight());
    }

    private void drawCells(TableBlock table, List<String> cells, Style style, float x, float top) throws IOException {
        float rowHeight = table.rowHeight();
        float textY = top - (rowHeight + style.fontSize() * 0.7f) / 2f;
        canvas.applyStyle(style);
        float cellX = x;
        List<Float> widths = table.columnWidths();
        for (int column = 0; column < widths.size(); column++) {
            float width = widths.get(column);
            canvas.strokeRectangle(cellX, top - rowHeight, width, rowHeight, table.gridColor(), GRID_LINE_WIDTH);
            if (column < cells.size() && !cells.get(column).isEmpty()) {
                canvas.drawText(cellX + CELL_PADDING, textY, cells.get(column));
            }
            cellX += width;
        }
    }

    private void breakPage(Section section, boolean continuation) throws IOException {
        int finished = pageNumber;
        finalizePage();
        openPage();
        if (continuation) {
            drawContinuationHeader(section);
        }
        log.debug("Page {} full, continuing on page {}", finished, pageNumber);
    }

    private void openPage() throws IOException {
        canvas.startPage(settings.pageWidth(), settings.pageHeight());
        pageNumber++;
        cursor.reset();
        canvas.applyStyle(activeStyle);
    }

    private void finalizePage() throws IOException {
        String footer = settings.footerText();
        if (!footer.isBlank()) {
            canvas.applyStyle(theme.style(Theme.FOOTER));
            canvas.drawCenteredText(settings.pageWidth() / 2f, settings.footerOffset(), footer);
        }
        canvas.finalizePage();
    }

    private void drawContinuationHeader(Section section) throws IOException {
        String header = section.hasTitle()
                ? section.title() + " (continued)"
                : settings.continuationText();
        canvas.drawText(settings.leftMargin(), settings.pageHeight() - settings.continuationHeaderOffset(), header);
    }

    private float leftEdge(Float x) {
        return x != null ? x : settings.leftMargin();
    }

    private float baseline(float top, float slotHeight, Style style) {
        return top - Math.min(style.fontSize(), slotHeight);
    }

    private void record(int sectionIndex, int blockIndex, int rowIndex, BlockPlacement.Part part,
                        float x, float y, float height) {
        placements.add(new BlockPlacement(pageNumber, sectionIndex, blockIndex, rowIndex, part, x, y, height));
    }

    private BlockTooLargeException tooLarge(int sectionIndex, Section section, int blockIndex, float height) {
        log.error("Block {} of section {} needs {}pt, usable page height is {}pt",
                blockIndex, sectionIndex, height, cursor.usableHeight());
        return new BlockTooLargeException(sectionIndex, section.title(), blockIndex, height, cursor.usableHeight());
    }
}
