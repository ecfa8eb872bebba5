package com.insighthub.report.interfaces.api;

import com.insighthub.report.application.command.ReportCommand;
import com.insighthub.report.application.service.ReportAssemblyService;
import com.insighthub.report.application.service.ReportRenderingService;
import com.insighthub.report.domain.layout.ReportDocument;
import com.insighthub.report.domain.model.RenderedReport;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.Locale;

/**
 * Interfaces-layer controller that renders report definitions into PDF downloads.
 */
@Controller
public class ReportController {

    static final String PAGE_COUNT_HEADER = "X-Page-Count";
    private static final String DEFAULT_FILE_NAME = "report";

    private final ReportAssemblyService assemblyService;
    private final ReportRenderingService renderingService;

    /**
     * Creates the controller with the required application services.
     *
     * @param assemblyService  service turning requests into documents
     * @param renderingService service responsible for PDF output
     */
    public ReportController(ReportAssemblyService assemblyService, ReportRenderingService renderingService) {
        this.assemblyService = assemblyService;
        this.renderingService = renderingService;
    }

    /**
     * Renders the posted report definition and streams the PDF back.
     *
     * @param command report title, sections and blocks
     * @return PDF document with its page count in the {@value #PAGE_COUNT_HEADER} header
     */
    @PostMapping(value = "/api/reports", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_PDF_VALUE)
    @ResponseBody
    public ResponseEntity<byte[]> renderReport(@RequestBody ReportCommand command) {
        ReportDocument document = assemblyService.assemble(command);
        RenderedReport report = renderingService.renderToBytes(document);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"" + fileName(command) + ".pdf\"")
                .header(PAGE_COUNT_HEADER, String.valueOf(report.pageCount()))
                .contentType(MediaType.APPLICATION_PDF)
                .body(report.content());
    }

    private String fileName(ReportCommand command) {
        if (command == null || command.title() == null) {
            return DEFAULT_FILE_NAME;
        }
        String slug = command.title().trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-|-$)", "");
        return slug.isEmpty() ? DEFAULT_FILE_NAME : slug;
    }
}
