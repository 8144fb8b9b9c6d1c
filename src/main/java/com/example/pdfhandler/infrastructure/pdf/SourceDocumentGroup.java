package com.example.pdfhandler.infrastructure.pdf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Owns the sources a merge opens one by one and keeps them alive until the merged output is saved.
 * Declare the group before the output in a try-with-resources block so the output is closed first.
 * Each source is released individually; a failing close does not prevent the others from closing.
 */
public final class SourceDocumentGroup implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SourceDocumentGroup.class);

    private final List<SourceDocument> sources = new ArrayList<>();
    private boolean closed;

    public void add(SourceDocument source) {
        if (closed) {
            source.close();
            throw new IllegalStateException("Source group already closed");
        }
        sources.add(source);
    }

    public int size() {
        return sources.size();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (SourceDocument source : sources) {
            try {
                source.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close source {}", source.path(), e);
            }
        }
        log.debug("Released {} source document(s)", sources.size());
    }
}
