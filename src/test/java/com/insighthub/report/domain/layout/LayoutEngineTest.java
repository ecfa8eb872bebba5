package com.insighthub.report.domain.layout;

import com.insighthub.report.domain.exception.BlockTooLargeException;
import com.insighthub.report.domain.model.BlockPlacement;
import com.insighthub.report.domain.model.ContentBlock;
import com.insighthub.report.domain.model.ImageBlock;
import com.insighthub.report.domain.model.ImageSource;
import com.insighthub.report.domain.model.LayoutResult;
import com.insighthub.report.domain.model.LayoutSettings;
import com.insighthub.report.domain.model.PageBreakBlock;
import com.insighthub.report.domain.model.RgbColor;
import com.insighthub.report.domain.model.RuleBlock;
import com.insighthub.report.domain.model.Section;
import com.insighthub.report.domain.model.SpacerBlock;
import com.insighthub.report.domain.model.Style;
import com.insighthub.report.domain.model.TableBlock;
import com.insighthub.report.domain.model.TextLinesBlock;
import com.insighthub.report.domain.model.Theme;
import com.insighthub.report.domain.layout.RecordingPageCanvas.TextDraw;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for pagination, page decoration and style handling of the layout engine.
 */
class LayoutEngineTest {

    private static final String FOOTER = "Generated by Insight Hub";

    private final Theme theme = Theme.defaultTheme();
    private final Style body = theme.style(Theme.BODY);
    private final RecordingPageCanvas canvas = new RecordingPageCanvas();

    /**
     * Content shorter than one page produces one page carrying one footer.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void shortContentFitsOnSinglePage() throws Exception {
        List<ContentBlock> blocks = List.of(
                TextLinesBlock.of(List.of("Summary", "of the dataset"), body, 15f),
                TextLinesBlock.of(List.of("Mean age: 42"), body, 15f));

        LayoutResult result = render(LayoutSettings.letter(FOOTER), Section.of("", blocks));

        assertThat(result.pageCount()).isEqualTo(1);
        assertThat(canvas.pagesStarted).isEqualTo(1);
        assertThat(canvas.pagesFinalized).isEqualTo(1);
        assertThat(canvas.finished).isTrue();
        assertThat(canvas.textsMatching(FOOTER)).hasSize(1);
    }

    /**
     * Overflowing a page by one line yields ceil(total / usable) pages, each with exactly one footer.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void overflowByOneLineAddsOnePage() throws Exception {
        LayoutSettings settings = LayoutSettings.builder()
                .pageSize(612f, 400f)
                .footerText(FOOTER)
                .build();
        // usable height 300 holds exactly 20 lines of 15pt
        LayoutResult result = render(settings, Section.of("", singleLines(21)));

        assertThat(result.pageCount()).isEqualTo(2);
        assertThat(canvas.pagesFinalized).isEqualTo(2);
        for (int page = 1; page <= 2; page++) {
            int current = page;
            assertThat(canvas.textsOnPage(page))
                    .filteredOn(text -> text.text().equals(FOOTER))
                    .as("footers on page %d", current)
                    .hasSize(1);
        }
        assertThat(result.placementsOnPage(1)).hasSize(20);
        assertThat(result.placementsOnPage(2)).hasSize(1);
    }

    /**
     * Fifty single lines on Letter pages with 50pt margins need two pages; the second one holds a
     * continuation header and the remaining four lines.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void fiftyLinesOnLetterPagesSplitFortySixAndFour() throws Exception {
        LayoutResult result = render(LayoutSettings.letter(FOOTER), Section.of("", singleLines(50)));

        assertThat(result.pageCount()).isEqualTo(2);
        assertThat(result.placementsOnPage(1)).hasSize(46);
        assertThat(result.placementsOnPage(2)).hasSize(4);

        List<TextDraw> secondPage = canvas.textsOnPage(2);
        assertThat(secondPage).extracting(TextDraw::text)
                .containsExactly("Continued Analysis", "line 46", "line 47", "line 48", "line 49", FOOTER);
        assertThat(secondPage.get(0).y()).isEqualTo(792f - 30f);
        assertThat(canvas.textsMatching(FOOTER)).extracting(TextDraw::page).containsExactly(1, 2);
    }

    /**
     * The footer is centered at its configured offset in the footer style.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void footerUsesFooterStyleAndOffset() throws Exception {
        render(LayoutSettings.letter(FOOTER), Section.of("", singleLines(1)));

        TextDraw footer = canvas.textsMatching(FOOTER).get(0);
        assertThat(footer.centered()).isTrue();
        assertThat(footer.x()).isEqualTo(306f);
        assertThat(footer.y()).isEqualTo(20f);
        assertThat(footer.style()).isEqualTo(theme.style(Theme.FOOTER));
    }

    /**
     * A blank footer text draws no footer at all.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void blankFooterIsNotDrawn() throws Exception {
        render(LayoutSettings.letter(" "), Section.of("", singleLines(3)));

        assertThat(canvas.texts).extracting(TextDraw::text).containsExactly("line 0", "line 1", "line 2");
        assertThat(canvas.pagesFinalized).isEqualTo(1);
    }

    /**
     * The continuation header and the resumed content keep the style active before the break.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void styleSurvivesPageBreak() throws Exception {
        Style highlight = new Style("Helvetica-Bold", 12f, new RgbColor(200, 30, 30));
        List<String> fullPage = IntStream.range(0, 46).mapToObj(i -> "finding " + i).toList();
        Section section = Section.of("", List.of(
                TextLinesBlock.of(fullPage, highlight, 15f),
                TextLinesBlock.of(List.of("after the break"), highlight, 15f)));
        LayoutEngine engine = new LayoutEngine(LayoutSettings.letter(FOOTER), theme, canvas);

        LayoutResult result = engine.render(List.of(section));

        assertThat(result.pageCount()).isEqualTo(2);
        TextDraw header = canvas.textsMatching("Continued Analysis").get(0);
        assertThat(header.page()).isEqualTo(2);
        assertThat(header.style()).isEqualTo(highlight);
        assertThat(canvas.textsMatching("after the break").get(0).style()).isEqualTo(highlight);
        assertThat(engine.activeStyle()).isEqualTo(highlight);
    }

    /**
     * The continuation header names the section being continued.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void titledSectionContinuationNamesSection() throws Exception {
        LayoutResult result = render(LayoutSettings.letter(FOOTER), Section.of("Results", singleLines(50)));

        assertThat(result.pageCount()).isEqualTo(2);
        // the 30pt title leaves room for 44 lines on the first page
        assertThat(result.placementsOnPage(1)).hasSize(45);
        assertThat(canvas.textsOnPage(2).get(0).text()).isEqualTo("Results (continued)");
        assertThat(canvas.textsMatching("Results").get(0).style()).isEqualTo(theme.style(Theme.HEADING));
    }

    /**
     * Rendering the same document twice produces identical draw sequences.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void renderingTwiceIsDeterministic() throws Exception {
        ReportDocument document = new ReportDocument(LayoutSettings.letter(FOOTER), theme);
        document.addSection(Section.of("Overview", singleLines(60)));
        document.addSection("Charts", List.of(ImageBlock.of(ImageSource.of("charts/age.png"), 400f, 300f)));

        RecordingPageCanvas first = new RecordingPageCanvas();
        RecordingPageCanvas second = new RecordingPageCanvas();
        LayoutResult firstResult = document.render(first);
        LayoutResult secondResult = document.render(second);

        assertThat(secondResult).isEqualTo(firstResult);
        assertThat(second.texts).isEqualTo(first.texts);
        assertThat(second.shapes).isEqualTo(first.shapes);
    }

    /**
     * A block exactly as tall as the usable height fills one page.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void blockOfUsableHeightFitsExactly() throws Exception {
        TextLinesBlock tall = TextLinesBlock.of(List.of("tall"), body, 692f);

        LayoutResult result = render(LayoutSettings.letter(FOOTER), Section.of("", List.of(tall)));

        assertThat(result.pageCount()).isEqualTo(1);
        BlockPlacement placement = result.placements().get(0);
        assertThat(placement.y()).isEqualTo(742f);
        assertThat(placement.y() - placement.height()).isEqualTo(50f);
    }

    /**
     * Lines whose fractional heights add up to exactly the usable height stay on one page.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void fractionalLinesFillingUsableHeightStayOnOnePage() throws Exception {
        float[] lineHeights = {10.1f, 10.2f, 12.3f, 13.7f, 14.4f, 15.6f};
        int[] counts = {40, 30, 25, 33, 17, 44};
        for (int i = 0; i < lineHeights.length; i++) {
            float lineHeight = lineHeights[i];
            int count = counts[i];
            LayoutSettings settings = LayoutSettings.builder()
                    .pageSize(612f, 100f + count * lineHeight)
                    .footerText(FOOTER)
                    .build();
            List<ContentBlock> blocks = new ArrayList<>();
            for (int line = 0; line < count; line++) {
                blocks.add(TextLinesBlock.of(List.of("line " + line), body, lineHeight));
            }

            LayoutResult result = new LayoutEngine(settings, theme, new RecordingPageCanvas())
                    .render(List.of(Section.of("", blocks)));

            assertThat(result.pageCount()).as("%d lines of %spt", count, lineHeight).isEqualTo(1);
        }
    }

    /**
     * A block one point taller than the usable height can never fit.
     */
    @Test
    void blockTallerThanUsableHeightIsRejected() {
        TextLinesBlock tooTall = TextLinesBlock.of(List.of("too tall"), body, 693f);
        Section section = Section.of("Distribution", List.of(tooTall));

        BlockTooLargeException ex = assertThrows(BlockTooLargeException.class,
                () -> render(LayoutSettings.letter(FOOTER), section));

        assertThat(ex.getSectionIndex()).isEqualTo(0);
        assertThat(ex.getSectionTitle()).isEqualTo("Distribution");
        assertThat(ex.getBlockIndex()).isEqualTo(0);
        assertThat(ex.getBlockHeight()).isEqualTo(693f);
        assertThat(ex.getUsableHeight()).isEqualTo(692f);
        assertThat(canvas.finished).isFalse();
    }

    /**
     * An oversized block further down a page is retried once on a fresh page before it is rejected.
     */
    @Test
    void oversizedBlockIsRetriedOnFreshPage() {
        ImageBlock huge = ImageBlock.of(ImageSource.of("charts/huge.png"), 400f, 700f);
        Section intro = Section.of("", singleLines(2));
        Section charts = Section.of("", List.of(huge));

        BlockTooLargeException ex = assertThrows(BlockTooLargeException.class,
                () -> render(LayoutSettings.letter(FOOTER), intro, charts));

        assertThat(ex.getSectionIndex()).isEqualTo(1);
        assertThat(canvas.pagesStarted).isEqualTo(2);
    }

    /**
     * Table headers are repeated on every page the table continues on.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void tableHeaderRepeatsOnEveryPage() throws Exception {
        LayoutSettings settings = LayoutSettings.builder()
                .pageSize(612f, 400f)
                .footerText(FOOTER)
                .build();
        List<List<String>> rows = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            rows.add(List.of("region " + i, String.valueOf(i * 10)));
        }
        TableBlock table = TableBlock.of(List.of("Region", "Cases"), rows, List.of(200f, 100f), 20f);

        LayoutResult result = render(settings, Section.of("", List.of(table)));

        // 300pt per page: header plus 14 rows
        assertThat(result.pageCount()).isEqualTo(3);
        List<BlockPlacement> headers = result.placements().stream()
                .filter(placement -> placement.part() == BlockPlacement.Part.TABLE_HEADER)
                .toList();
        assertThat(headers).extracting(BlockPlacement::pageNumber).containsExactly(1, 2, 3);
        assertThat(canvas.textsMatching("Region")).extracting(TextDraw::page).containsExactly(1, 2, 3);
        assertThat(canvas.textsMatching("Region").get(0).style()).isEqualTo(theme.style(Theme.TABLE_HEADER));
        assertThat(canvas.textsMatching("region 0").get(0).style()).isEqualTo(theme.style(Theme.TABLE_BODY));
        assertThat(result.placementsOnPage(3)).extracting(BlockPlacement::rowIndex).containsExactly(-1, 28, 29);
        assertThat(canvas.shapes).filteredOn(shape -> shape.kind().equals("fill"))
                .extracting(RecordingPageCanvas.ShapeDraw::color)
                .containsOnly(TableBlock.DEFAULT_HEADER_FILL);
    }

    /**
     * A table header is moved to the next page instead of being left without rows.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void tableHeaderIsNotOrphaned() throws Exception {
        List<String> lines = IntStream.range(0, 45).mapToObj(i -> "line " + i).toList();
        TableBlock table = TableBlock.of(List.of("Metric", "Value"), List.of(List.of("mean", "4.2")),
                List.of(150f, 100f), 20f);
        Section section = Section.of("", List.of(TextLinesBlock.of(lines, body, 15f), table));

        LayoutResult result = render(LayoutSettings.letter(FOOTER), section);

        assertThat(result.pageCount()).isEqualTo(2);
        assertThat(canvas.textsMatching("Metric").get(0).page()).isEqualTo(2);
    }

    /**
     * Missing images are replaced by a gray placeholder naming the file.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void missingImageDrawsPlaceholder() throws Exception {
        ImageSource present = ImageSource.of("charts/present.png");
        canvas.existingImages.add(present);
        Section section = Section.of("Charts", List.of(
                ImageBlock.of(present, 300f, 200f),
                ImageBlock.of(ImageSource.of("charts/missing.png"), 300f, 200f)));

        render(LayoutSettings.letter(FOOTER), section);

        assertThat(canvas.shapes).extracting(RecordingPageCanvas.ShapeDraw::kind).containsExactly("image", "fill");
        RecordingPageCanvas.ShapeDraw placeholder = canvas.shapes.get(1);
        assertThat(placeholder.color()).isEqualTo(RgbColor.fromHex("#CCCCCC"));
        assertThat(placeholder.width()).isEqualTo(300f);
        TextDraw caption = canvas.textsMatching("Image not available: missing.png").get(0);
        assertThat(caption.centered()).isTrue();
        assertThat(caption.style()).isEqualTo(theme.style(Theme.CAPTION));
    }

    /**
     * Explicit page breaks start a new page, except at the top of a page.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void pageBreakStartsNewPageUnlessAtTop() throws Exception {
        Section section = Section.of("", List.of(
                PageBreakBlock.INSTANCE,
                TextLinesBlock.of(List.of("first"), body, 15f),
                PageBreakBlock.INSTANCE,
                TextLinesBlock.of(List.of("second"), body, 15f)));

        LayoutResult result = render(LayoutSettings.letter(FOOTER), section);

        assertThat(result.pageCount()).isEqualTo(2);
        assertThat(canvas.textsMatching("second").get(0).page()).isEqualTo(2);
    }

    /**
     * A spacer that does not fit at the bottom of a page is dropped and opens no page.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void spacerAtPageBottomIsDropped() throws Exception {
        List<ContentBlock> blocks = new ArrayList<>(singleLines(46));
        blocks.add(new SpacerBlock(20f));

        LayoutResult result = render(LayoutSettings.letter(FOOTER), Section.of("", blocks));

        assertThat(result.pageCount()).isEqualTo(1);
    }

    /**
     * Sections flagged to start on a new page do so without a continuation header.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void sectionStartsOnNewPage() throws Exception {
        Section intro = Section.of("Introduction", singleLines(2));
        Section appendix = new Section("Appendix", singleLines(2), true);

        LayoutResult result = render(LayoutSettings.letter(FOOTER), intro, appendix);

        assertThat(result.pageCount()).isEqualTo(2);
        assertThat(canvas.textsOnPage(2).get(0).text()).isEqualTo("Appendix");
        assertThat(canvas.texts).extracting(TextDraw::text).noneMatch(text -> text.contains("(continued)"));
    }

    /**
     * A section title is moved to the next page together with its first block.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void sectionTitleKeepsWithFirstBlock() throws Exception {
        Section filler = Section.of("", singleLines(44));
        Section next = Section.of("Trends", List.of(TextLinesBlock.of(List.of("a", "b", "c"), body, 15f)));

        LayoutResult result = render(LayoutSettings.letter(FOOTER), filler, next);

        BlockPlacement title = result.placements().stream()
                .filter(placement -> placement.part() == BlockPlacement.Part.SECTION_TITLE)
                .findFirst()
                .orElseThrow();
        assertThat(title.pageNumber()).isEqualTo(2);
        assertThat(title.y()).isEqualTo(742f);
    }

    /**
     * Rules span the content width in their own color.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void ruleSpansContentWidth() throws Exception {
        RgbColor accent = RgbColor.fromHex("#2E86AB");

        render(LayoutSettings.letter(FOOTER), Section.of("", List.of(new RuleBlock(10f, accent, 1f))));

        RecordingPageCanvas.ShapeDraw line = canvas.shapes.get(0);
        assertThat(line.kind()).isEqualTo("line");
        assertThat(line.x()).isEqualTo(50f);
        assertThat(line.width()).isEqualTo(512f);
        assertThat(line.y()).isEqualTo(737f);
        assertThat(line.color()).isEqualTo(accent);
    }

    /**
     * Centered text is centered between the block's left edge and the right margin.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void centeredTextUsesContentCenter() throws Exception {
        Style title = theme.style(Theme.TITLE);
        render(LayoutSettings.letter(FOOTER), Section.of("", List.of(
                TextLinesBlock.centered(List.of("Diabetes Insight"), title, 30f))));

        TextDraw draw = canvas.textsMatching("Diabetes Insight").get(0);
        assertThat(draw.centered()).isTrue();
        assertThat(draw.x()).isEqualTo(306f);
        assertThat(draw.y()).isEqualTo(742f - 24f);
    }

    /**
     * An engine lays out a single report only.
     *
     * @throws Exception when the canvas fails
     */
    @Test
    void engineCannotBeReused() throws Exception {
        LayoutEngine engine = new LayoutEngine(LayoutSettings.letter(FOOTER), theme, canvas);
        engine.render(List.of(Section.of("", singleLines(1))));

        assertThrows(IllegalStateException.class, () -> engine.render(List.of()));
    }

    private LayoutResult render(LayoutSettings settings, Section... sections) throws Exception {
        return new LayoutEngine(settings, theme, canvas).render(List.of(sections));
    }

    private List<ContentBlock> singleLines(int count) {
        List<ContentBlock> blocks = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            blocks.add(TextLinesBlock.of(List.of("line " + i), body, 15f));
        }
        return blocks;
    }
}
