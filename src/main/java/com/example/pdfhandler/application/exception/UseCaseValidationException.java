package com.example.pdfhandler.application.exception;

/**
 * Signals request-shape problems detected before a batch is handed to the worker,
 * such as a split mode without its parameters.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * Builds an exception containing a validation message that can be propagated to the UI.
	 *
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
