package com.example.pdfhandler.domain.exception;

import com.example.pdfhandler.domain.model.NamingPattern;

/**
 * Raised when an output naming pattern is blank or lacks the {@value NamingPattern#PLACEHOLDER} token.
 */
public class InvalidNamingPatternException extends InvalidBatchArgumentException {

	/**
	 * Creates the exception mentioning the offending pattern.
	 *
	 * @param pattern pattern supplied by the caller, may be {@code null}
	 */
    public InvalidNamingPatternException(String pattern) {
        super("File name pattern must contain " + NamingPattern.PLACEHOLDER
                + (pattern != null ? ": " + pattern : "."));
    }
}
