package com.example.pdfhandler.infrastructure.exception;

import java.nio.file.Path;

/**
 * Signals that a page could not be imported from a source document into an output document.
 */
public class PdfPageCopyException extends InfrastructureException {

    public PdfPageCopyException(Path source, int pageIndex, Throwable cause) {
        super("Unable to copy page " + (pageIndex + 1) + " of " + source, cause);
    }
}
