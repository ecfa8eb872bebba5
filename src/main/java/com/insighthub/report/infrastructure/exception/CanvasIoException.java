package com.insighthub.report.infrastructure.exception;

/**
 * Signals that the drawing surface could not draw, write or flush the report.
 * Any artifact written before the failure is incomplete and must be discarded.
 */
public class CanvasIoException extends InfrastructureException {
	/**
	 * Creates the exception with a contextual message and the root cause from PDFBox.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level IO or PDFBox exception
	 */
    public CanvasIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
