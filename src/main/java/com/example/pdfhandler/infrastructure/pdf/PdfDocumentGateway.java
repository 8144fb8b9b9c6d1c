package com.example.pdfhandler.infrastructure.pdf;

import com.example.pdfhandler.infrastructure.exception.PdfOpenException;

import java.nio.file.Path;

/**
 * Entry point of the document handle abstraction used by the merge and split engines.
 * Hides the PDF library behind open/append/save/close operations.
 */
public interface PdfDocumentGateway {

    /**
     * Reads the file into memory and opens it for page import.
     *
     * @param path source PDF
     * @return open handle owned by the caller
     * @throws PdfOpenException when the file is missing or not a parseable PDF
     */
    SourceDocument open(Path path);

    /**
     * Creates an empty output document that will be saved to {@code target}.
     *
     * @param target destination file
     * @return open handle owned by the caller
     */
    OutputDocument create(Path target);
}
