package com.insighthub.report.application.service;

import com.insighthub.report.domain.exception.BlockTooLargeException;
import com.insighthub.report.domain.exception.InvalidConfigurationException;
import com.insighthub.report.domain.layout.ReportDocument;
import com.insighthub.report.domain.model.ContentBlock;
import com.insighthub.report.domain.model.LayoutResult;
import com.insighthub.report.domain.model.RenderedReport;
import com.insighthub.report.domain.model.Section;
import com.insighthub.report.domain.model.Style;
import com.insighthub.report.domain.model.TextLinesBlock;
import com.insighthub.report.infrastructure.exception.CanvasIoException;
import com.insighthub.report.infrastructure.pdf.PdfBoxMetadataWriter;
import com.insighthub.report.infrastructure.pdf.PdfBoxPageCanvas;
import com.insighthub.report.infrastructure.pdf.PdfFonts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Application-layer service that renders a {@link ReportDocument} to PDF.
 * It owns the output handle: the handle is opened once per render and closed on every exit path,
 * and a file left behind by a failed render is deleted.
 */
@Service
public class ReportRenderingService {

    private static final Logger log = LoggerFactory.getLogger(ReportRenderingService.class);

    private final PdfBoxMetadataWriter metadataWriter;

    /**
     * Creates the service with the infrastructure metadata writer dependency.
     *
     * @param metadataWriter helper storing title/author/creator in the generated PDF
     */
    public ReportRenderingService(PdfBoxMetadataWriter metadataWriter) {
        this.metadataWriter = metadataWriter;
    }

    /**
     * Renders the document into memory.
     *
     * @param document report to render
     * @return PDF bytes with page count and placements
     * @throws InvalidConfigurationException when a style names a font PDFBox cannot provide
     * @throws BlockTooLargeException        when a block cannot fit on any page
     * @throws CanvasIoException             when PDFBox fails to draw or save
     */
    public RenderedReport renderToBytes(ReportDocument document) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        LayoutResult layout = render(document, buffer);
        return new RenderedReport(buffer.toByteArray(), layout);
    }

    /**
     * Renders the document to a file, replacing any existing file.
     *
     * @param document report to render
     * @param output   destination path
     * @return page count and placements
     * @throws BlockTooLargeException when a block cannot fit on any page; no file is left behind
     * @throws CanvasIoException      when the file cannot be written; no file is left behind
     */
    public LayoutResult renderToFile(ReportDocument document, Path output) {
        if (output == null) {
            throw new IllegalArgumentException("Output path is required.");
        }
        validate(document);
        boolean opened = false;
        boolean completed = false;
        try {
            LayoutResult layout;
            try (OutputStream stream = new BufferedOutputStream(Files.newOutputStream(output))) {
                opened = true;
                layout = renderValidated(document, stream);
            }
            completed = true;
            log.info("Report written to {} ({} page(s))", output, layout.pageCount());
            return layout;
        } catch (IOException e) {
            throw new CanvasIoException("Unable to write the report to " + output, e);
        } finally {
            if (opened && !completed) {
                discardPartialOutput(output);
            }
        }
    }

    /**
     * Renders the document to a caller owned stream. The stream is flushed but not closed.
     *
     * @param document report to render
     * @param output   destination stream
     * @return page count and placements
     */
    public LayoutResult render(ReportDocument document, OutputStream output) {
        validate(document);
        return renderValidated(document, output);
    }

    private LayoutResult renderValidated(ReportDocument document, OutputStream output) {
        try (PdfBoxPageCanvas canvas = new PdfBoxPageCanvas(output, document.getMetadata(), metadataWriter)) {
            return document.render(canvas);
        } catch (IOException e) {
            throw new CanvasIoException("Unable to render the report.", e);
        } catch (BlockTooLargeException e) {
            log.warn("Report rendering aborted: {}", e.getMessage());
            throw e;
        }
    }

    private void validate(ReportDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("Report document is required.");
        }
        PdfFonts.requireSupported(referencedStyles(document));
    }

    /**
     * Collects every style a render will draw with, so fonts are checked before the first page.
     *
     * @param document document about to render
     * @return theme styles plus text block styles
     */
    private List<Style> referencedStyles(ReportDocument document) {
        List<Style> styles = new ArrayList<>(document.getTheme().styles().values());
        for (Section section : document.getSections()) {
            for (ContentBlock block : section.blocks()) {
                if (block instanceof TextLinesBlock text) {
                    styles.add(text.style());
                }
            }
        }
        return styles;
    }

    private void discardPartialOutput(Path output) {
        try {
            Files.deleteIfExists(output);
        } catch (IOException e) {
            log.warn("Unable to delete incomplete report {}", output, e);
        }
    }
}
