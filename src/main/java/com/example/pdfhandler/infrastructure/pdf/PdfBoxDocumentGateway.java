package com.example.pdfhandler.infrastructure.pdf;

import com.example.pdfhandler.infrastructure.exception.PdfOpenException;
import com.example.pdfhandler.infrastructure.exception.PdfPageCopyException;
import com.example.pdfhandler.infrastructure.exception.PdfSaveException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * PDFBox implementation of {@link PdfDocumentGateway}.
 * Sources are parsed from an in-memory byte copy; pages are copied with {@link PDDocument#importPage(PDPage)},
 * which shares the source's resources until the output is saved.
 */
@Component
public class PdfBoxDocumentGateway implements PdfDocumentGateway {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDocumentGateway.class);

    @Override
    public SourceDocument open(Path path) {
        try {
            byte[] bytes = Files.readAllBytes(path);
            PDDocument document = Loader.loadPDF(bytes);
            log.debug("Opened {} ({} bytes, {} pages)", path, bytes.length, document.getNumberOfPages());
            return new PdfBoxSourceDocument(path, document);
        } catch (IOException e) {
            throw new PdfOpenException(path, e);
        }
    }

    @Override
    public OutputDocument create(Path target) {
        return new PdfBoxOutputDocument(target, new PDDocument());
    }

    /**
     * Closes a PDFBox document, logging instead of propagating close failures so that
     * cleanup of the remaining handles still runs.
     */
    private static void closeQuietly(PDDocument document, Path path) {
        try {
            document.close();
        } catch (IOException e) {
            log.warn("Failed to release PDF handle for {}", path, e);
        }
    }

    static final class PdfBoxSourceDocument implements SourceDocument {

        private final Path path;
        private final PDDocument document;
        private boolean closed;

        PdfBoxSourceDocument(Path path, PDDocument document) {
            this.path = path;
            this.document = document;
        }

        @Override
        public Path path() {
            return path;
        }

        @Override
        public int pageCount() {
            ensureOpen();
            return document.getNumberOfPages();
        }

        PDPage page(int pageIndex) {
            ensureOpen();
            if (pageIndex < 0 || pageIndex >= document.getNumberOfPages()) {
                throw new PdfPageCopyException(path, pageIndex,
                        new IndexOutOfBoundsException("Page index " + pageIndex + " of " + document.getNumberOfPages()));
            }
            return document.getPage(pageIndex);
        }

        private void ensureOpen() {
            if (closed) {
                throw new IllegalStateException("Source document already closed: " + path);
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            closeQuietly(document, path);
        }
    }

    static final class PdfBoxOutputDocument implements OutputDocument {

        private final Path target;
        private final PDDocument document;
        private boolean closed;

        PdfBoxOutputDocument(Path target, PDDocument document) {
            this.target = target;
            this.document = document;
        }

        @Override
        public Path target() {
            return target;
        }

        @Override
        public void appendPage(SourceDocument source, int pageIndex) {
            ensureOpen();
            if (!(source instanceof PdfBoxSourceDocument pdfBoxSource)) {
                throw new IllegalArgumentException("Unsupported source document type: " + source.getClass().getName());
            }
            PDPage page = pdfBoxSource.page(pageIndex);
            try {
                document.importPage(page);
            } catch (IOException e) {
                throw new PdfPageCopyException(source.path(), pageIndex, e);
            }
        }

        @Override
        public int pageCount() {
            ensureOpen();
            return document.getNumberOfPages();
        }

        @Override
        public void discardPagesFrom(int pageIndex) {
            ensureOpen();
            while (document.getNumberOfPages() > Math.max(pageIndex, 0)) {
                document.removePage(document.getNumberOfPages() - 1);
            }
        }

        @Override
        public void save() {
            ensureOpen();
            try {
                Path parent = target.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                document.save(target.toFile());
            } catch (IOException e) {
                throw new PdfSaveException(target, e);
            }
        }

        private void ensureOpen() {
            if (closed) {
                throw new IllegalStateException("Output document already closed: " + target);
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            closeQuietly(document, target);
        }
    }
}
