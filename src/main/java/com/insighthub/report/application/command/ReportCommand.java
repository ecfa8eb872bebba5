package com.insighthub.report.application.command;

import java.util.List;

/**
 * Caller supplied description of a report: document properties plus sections in order.
 */
public record ReportCommand(
        String title,
        String author,
        String subject,
        List<SectionCommand> sections
) {
}
