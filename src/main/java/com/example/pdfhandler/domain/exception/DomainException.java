package com.example.pdfhandler.domain.exception;

/**
 * Base type for all domain-level exceptions in the merge/split model.
 * Subclasses capture invariant violations on batch arguments without leaking PDF library types.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of which invariant broke
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * Creates a domain exception that wraps an underlying cause.
	 *
	 * @param message explanation of which invariant broke
	 * @param cause   original exception that triggered the domain failure
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
