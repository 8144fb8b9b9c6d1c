package com.example.pdfhandler.infrastructure.pdf;

import com.example.pdfhandler.infrastructure.exception.PdfPageCopyException;
import com.example.pdfhandler.infrastructure.exception.PdfSaveException;

import java.nio.file.Path;

/**
 * Writable, initially empty PDF accumulating copied pages for a single target file.
 * Append order is the final page order.
 *
 * <p>An output must be closed before the sources it copied from. {@link #close()} is idempotent.</p>
 */
public interface OutputDocument extends AutoCloseable {

    Path target();

    /**
     * Appends a structural copy of a source page.
     *
     * @param source    open source document
     * @param pageIndex 0-based page index inside {@code source}
     * @throws PdfPageCopyException when the page does not exist or cannot be imported
     */
    void appendPage(SourceDocument source, int pageIndex);

    int pageCount();

    /**
     * Removes every page at or after {@code pageIndex}, used to roll back a partially copied source.
     *
     * @param pageIndex first 0-based index to drop
     */
    void discardPagesFrom(int pageIndex);

    /**
     * Writes the accumulated pages to {@link #target()}, creating missing parent directories first.
     *
     * @throws PdfSaveException when the file cannot be written
     */
    void save();

    @Override
    void close();
}
