package com.example.pdfhandler.infrastructure.exception;

import java.nio.file.Path;

/**
 * Signals that an output PDF could not be written (disk full, permission denied, invalid path).
 */
public class PdfSaveException extends InfrastructureException {

	/**
	 * Creates the exception for the given target.
	 *
	 * @param target file the output document was being written to
	 * @param cause  low-level IO exception
	 */
    public PdfSaveException(Path target, Throwable cause) {
        super("Unable to save PDF to " + target, cause);
    }
}
