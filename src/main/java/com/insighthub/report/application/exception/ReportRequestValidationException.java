package com.insighthub.report.application.exception;

/**
 * Thrown when a report command cannot be turned into a document: unknown block types, missing
 * lines or rows, or sizes that are not positive.
 */
public class ReportRequestValidationException extends UseCaseValidationException {

	/**
	 * Creates a new exception describing why the report request is invalid.
	 *
	 * @param message validation message naming the offending section or block
	 */
    public ReportRequestValidationException(String message) {
        super(message);
    }

    public ReportRequestValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
