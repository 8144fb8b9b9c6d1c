package com.example.pdfhandler.infrastructure.pdf;

import java.nio.file.Path;

/**
 * Read-only handle on a source PDF that was loaded completely into memory.
 * No OS file handle on {@link #path()} is held while the handle is open.
 *
 * <p>A source must stay open until every {@link OutputDocument} that copied pages from it has been
 * saved and closed. {@link #close()} is safe to call more than once; only the first call releases.</p>
 */
public interface SourceDocument extends AutoCloseable {

    Path path();

    int pageCount();

    @Override
    void close();
}
