package com.example.pdfhandler.infrastructure.exception;

import java.nio.file.Path;

/**
 * Signals that a source PDF could not be read into memory or parsed by PDFBox.
 */
public class PdfOpenException extends InfrastructureException {

	/**
	 * Creates the exception for the given source.
	 *
	 * @param path  source that failed to open
	 * @param cause low-level IO or PDFBox exception
	 */
    public PdfOpenException(Path path, Throwable cause) {
        super("Unable to open PDF " + path, cause);
    }
}
