package com.example.pdfhandler.domain.exception;

import java.nio.file.Path;

/**
 * Raised when a batch references a source PDF that does not exist on disk.
 * Split operations treat this as fatal because they have exactly one source.
 */
public class PdfNotFoundException extends DomainException {

    private final Path path;

	/**
	 * Creates the exception and records the missing path as part of the message.
	 *
	 * @param path path that could not be resolved
	 */
    public PdfNotFoundException(Path path) {
        super("PDF not found: " + path.toAbsolutePath());
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
