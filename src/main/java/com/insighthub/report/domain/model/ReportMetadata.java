package com.insighthub.report.domain.model;

/**
 * Descriptive document properties written into the generated file.
 * Every field is optional.
 */
public record ReportMetadata(
        String title,
        String author,
        String subject,
        String creator
) {

    public static ReportMetadata empty() {
        return new ReportMetadata(null, null, null, null);
    }
}
