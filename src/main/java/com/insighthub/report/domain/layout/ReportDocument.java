package com.insighthub.report.domain.layout;

import com.insighthub.report.domain.exception.DocumentFrozenException;
import com.insighthub.report.domain.exception.InvalidConfigurationException;
import com.insighthub.report.domain.model.ContentBlock;
import com.insighthub.report.domain.model.LayoutResult;
import com.insighthub.report.domain.model.LayoutSettings;
import com.insighthub.report.domain.model.ReportMetadata;
import com.insighthub.report.domain.model.Section;
import com.insighthub.report.domain.model.Theme;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A report under construction: ordered sections plus the page settings and theme they are laid
 * out with.
 * <p>
 * Sections are appended in the order the analysis emits them. Once the document has been
 * rendered its content is frozen; rendering it again is allowed and produces the same layout
 * because every render uses a fresh {@link LayoutEngine}.
 */
public class ReportDocument {

    private final LayoutSettings settings;
    private final Theme theme;
    private final ReportMetadata metadata;
    private final List<Section> sections = new ArrayList<>();
    private boolean rendered;

	/**
	 * Creates an empty document.
	 *
	 * @param settings page geometry, margins and footer
	 * @param theme    role to style mapping
	 * @param metadata document properties, {@code null} for none
	 * @throws InvalidConfigurationException when settings or theme are missing
	 */
    public ReportDocument(LayoutSettings settings, Theme theme, ReportMetadata metadata) {
        if (settings == null) {
            throw new InvalidConfigurationException("Layout settings are required.");
        }
        if (theme == null) {
            throw new InvalidConfigurationException("A theme is required.");
        }
        this.settings = settings;
        this.theme = theme;
        this.metadata = metadata == null ? ReportMetadata.empty() : metadata;
    }

    public ReportDocument(LayoutSettings settings, Theme theme) {
        this(settings, theme, null);
    }

	/**
	 * Appends a section after the ones already added.
	 *
	 * @param section section to append
	 * @return this document for chaining
	 * @throws DocumentFrozenException when the document was already rendered
	 */
    public ReportDocument addSection(Section section) {
        if (section == null) {
            throw new IllegalArgumentException("Section is required.");
        }
        if (rendered) {
            throw new DocumentFrozenException(section.title());
        }
        sections.add(section);
        return this;
    }

    public ReportDocument addSection(String title, List<ContentBlock> blocks) {
        return addSection(Section.of(title, blocks));
    }

	/**
	 * Lays the document out onto the canvas and flushes it.
	 * The canvas is not closed; whoever opened it owns that.
	 *
	 * @param canvas target surface
	 * @return page count and placements
	 * @throws IOException when the canvas fails
	 */
    public LayoutResult render(PageCanvas canvas) throws IOException {
        rendered = true;
        return new LayoutEngine(settings, theme, canvas).render(getSections());
    }

    public List<Section> getSections() {
        return Collections.unmodifiableList(sections);
    }

    public LayoutSettings getSettings() {
        return settings;
    }

    public Theme getTheme() {
        return theme;
    }

    public ReportMetadata getMetadata() {
        return metadata;
    }

    public boolean isRendered() {
        return rendered;
    }
}
