package com.insighthub.report.application.service;

import com.insighthub.report.application.command.BlockCommand;
import com.insighthub.report.application.command.ReportCommand;
import com.insighthub.report.application.command.SectionCommand;
import com.insighthub.report.application.exception.ReportRequestValidationException;
import com.insighthub.report.domain.exception.InvalidConfigurationException;
import com.insighthub.report.domain.layout.ReportDocument;
import com.insighthub.report.domain.model.BlockKind;
import com.insighthub.report.domain.model.ContentBlock;
import com.insighthub.report.domain.model.ImageBlock;
import com.insighthub.report.domain.model.ImageSource;
import com.insighthub.report.domain.model.LayoutSettings;
import com.insighthub.report.domain.model.PageBreakBlock;
import com.insighthub.report.domain.model.ReportMetadata;
import com.insighthub.report.domain.model.RgbColor;
import com.insighthub.report.domain.model.RuleBlock;
import com.insighthub.report.domain.model.Section;
import com.insighthub.report.domain.model.SpacerBlock;
import com.insighthub.report.domain.model.TableBlock;
import com.insighthub.report.domain.model.TextAlignment;
import com.insighthub.report.domain.model.TextLinesBlock;
import com.insighthub.report.domain.model.Theme;
import com.insighthub.report.infrastructure.config.ReportLayoutProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Application-layer service that turns a caller supplied {@link ReportCommand} into a
 * {@link ReportDocument} laid out with the configured page settings and theme.
 * All input checks happen here so the layout core only ever sees well formed blocks.
 */
@Service
public class ReportAssemblyService {

    private static final Logger log = LoggerFactory.getLogger(ReportAssemblyService.class);
    private static final float DEFAULT_RULE_HEIGHT = 10f;
    private static final float DEFAULT_RULE_WIDTH = 1f;
    private static final float TABLE_ROW_PADDING = 5f;

    private final ReportLayoutProperties properties;

    /**
     * Creates the service with the bound layout configuration.
     *
     * @param properties page settings, footer and theme overrides
     */
    public ReportAssemblyService(ReportLayoutProperties properties) {
        this.properties = properties;
    }

	/**
	 * Validates the command and builds the document it describes.
	 *
	 * @param command report description
	 * @return document ready to render
	 * @throws ReportRequestValidationException when the command is incomplete or malformed
	 * @throws InvalidConfigurationException    when the configured layout is unusable
	 */
    public ReportDocument assemble(ReportCommand command) {
        if (command == null) {
            throw new ReportRequestValidationException("A report definition is required.");
        }
        if (command.sections() == null || command.sections().isEmpty()) {
            throw new ReportRequestValidationException("A report needs at least one section.");
        }

        LayoutSettings settings = properties.toSettings();
        Theme theme = properties.toTheme();
        ReportMetadata metadata = new ReportMetadata(command.title(), command.author(), command.subject(),
                properties.getCreator());
        ReportDocument document = new ReportDocument(settings, theme, metadata);

        List<SectionCommand> sections = command.sections();
        for (int sectionIndex = 0; sectionIndex < sections.size(); sectionIndex++) {
            document.addSection(toSection(sectionIndex, sections.get(sectionIndex), settings, theme));
        }
        log.debug("Assembled report '{}' with {} section(s)", command.title(), sections.size());
        return document;
    }

    private Section toSection(int sectionIndex, SectionCommand command, LayoutSettings settings, Theme theme) {
        if (command == null) {
            throw new ReportRequestValidationException("Section " + sectionIndex + " is empty.");
        }
        List<BlockCommand> blockCommands = command.blocks() == null ? List.of() : command.blocks();
        List<ContentBlock> blocks = new ArrayList<>(blockCommands.size());
        for (int blockIndex = 0; blockIndex < blockCommands.size(); blockIndex++) {
            String where = "section " + sectionIndex + ", block " + blockIndex;
            try {
                blocks.add(toBlock(where, blockCommands.get(blockIndex), settings, theme));
            } catch (IllegalArgumentException ex) {
                throw new ReportRequestValidationException("Invalid " + where + ": " + ex.getMessage(), ex);
            }
        }
        return new Section(command.title(), blocks, Boolean.TRUE.equals(command.startOnNewPage()));
    }

    private ContentBlock toBlock(String where, BlockCommand command, LayoutSettings settings, Theme theme) {
        if (command == null) {
            throw new ReportRequestValidationException("Missing " + where + ".");
        }
        BlockKind kind = BlockKind.fromString(command.type());
        if (kind == null) {
            throw new ReportRequestValidationException("Unknown block type '" + command.type() + "' at " + where + ".");
        }
        return switch (kind) {
            case TEXT -> toText(where, command, settings, theme);
            case IMAGE -> toImage(where, command);
            case TABLE -> toTable(where, command, settings);
            case SPACER -> new SpacerBlock(require(where, "height", command.height()));
            case RULE -> new RuleBlock(
                    orDefault(command.height(), DEFAULT_RULE_HEIGHT),
                    command.color() != null ? RgbColor.fromHex(command.color()) : theme.style(Theme.HEADING).color(),
                    orDefault(command.lineWidth(), DEFAULT_RULE_WIDTH));
            case PAGE_BREAK -> PageBreakBlock.INSTANCE;
        };
    }

    private TextLinesBlock toText(String where, BlockCommand command, LayoutSettings settings, Theme theme) {
        if (command.lines() == null) {
            throw new ReportRequestValidationException("Text block at " + where + " has no lines.");
        }
        String role = command.role() == null || command.role().isBlank() ? Theme.BODY : command.role();
        if (!theme.hasRole(role)) {
            throw new ReportRequestValidationException("Unknown style role '" + role + "' at " + where + ".");
        }
        return new TextLinesBlock(
                command.lines(),
                theme.style(role),
                orDefault(command.lineHeight(), settings.lineHeight()),
                command.x(),
                toAlignment(where, command.align()));
    }

    private ImageBlock toImage(String where, BlockCommand command) {
        if (command.imagePath() == null || command.imagePath().isBlank()) {
            throw new ReportRequestValidationException("Image block at " + where + " has no image path.");
        }
        return new ImageBlock(
                ImageSource.of(command.imagePath()),
                command.x(),
                require(where, "width", command.width()),
                require(where, "height", command.height()));
    }

    private TableBlock toTable(String where, BlockCommand command, LayoutSettings settings) {
        if (command.columnWidths() == null || command.columnWidths().isEmpty()) {
            throw new ReportRequestValidationException("Table at " + where + " has no column widths.");
        }
        return new TableBlock(
                command.header(),
                command.rows(),
                command.columnWidths(),
                orDefault(command.rowHeight(), settings.lineHeight() + TABLE_ROW_PADDING),
                command.x(),
                null,
                null);
    }

    private TextAlignment toAlignment(String where, String align) {
        if (align == null || align.isBlank()) {
            return TextAlignment.LEFT;
        }
        try {
            return TextAlignment.valueOf(align.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ReportRequestValidationException("Unknown alignment '" + align + "' at " + where + ".");
        }
    }

    private float require(String where, String field, Float value) {
        if (value == null) {
            throw new ReportRequestValidationException("Missing " + field + " at " + where + ".");
        }
        return value;
    }

    private float orDefault(Float value, float fallback) {
        return value != null ? value : fallback;
    }
}
