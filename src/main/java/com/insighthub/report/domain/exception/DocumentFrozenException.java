package com.insighthub.report.domain.exception;

/**
 * Raised when a caller tries to append a section to a document that has already been rendered.
 */
public class DocumentFrozenException extends DomainException {

    public DocumentFrozenException(String title) {
        super("Report already rendered, cannot append section"
                + (title != null && !title.isBlank() ? ": " + title : "."));
    }
}
