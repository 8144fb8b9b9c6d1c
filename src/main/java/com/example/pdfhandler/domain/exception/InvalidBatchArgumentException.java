package com.example.pdfhandler.domain.exception;

/**
 * Raised when a merge or split request is malformed and must be rejected before any file is touched.
 */
public class InvalidBatchArgumentException extends DomainException {

	/**
	 * Creates the exception with the validation message shown to the caller.
	 *
	 * @param message which argument was rejected and why
	 */
    public InvalidBatchArgumentException(String message) {
        super(message);
    }
}
