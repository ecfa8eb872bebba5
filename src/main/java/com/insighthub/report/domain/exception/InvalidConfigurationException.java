package com.insighthub.report.domain.exception;

/**
 * Raised when page geometry, margins or the theme cannot support layout.
 * Detected while constructing settings and documents, before anything is drawn.
 */
public class InvalidConfigurationException extends DomainException {

	/**
	 * Creates the exception with the offending setting described in the message.
	 *
	 * @param message which setting is invalid and why
	 */
    public InvalidConfigurationException(String message) {
        super(message);
    }
}
