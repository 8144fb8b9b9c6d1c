package com.example.pdfhandler.application.service;

import com.example.pdfhandler.application.progress.ProgressSink;
import com.example.pdfhandler.application.progress.ProgressTracker;
import com.example.pdfhandler.domain.exception.InvalidBatchArgumentException;
import com.example.pdfhandler.domain.model.BatchKind;
import com.example.pdfhandler.domain.model.BatchOutcome;
import com.example.pdfhandler.domain.model.ItemOutcome;
import com.example.pdfhandler.infrastructure.exception.PdfSaveException;
import com.example.pdfhandler.infrastructure.pdf.OutputDocument;
import com.example.pdfhandler.infrastructure.pdf.PdfDocumentGateway;
import com.example.pdfhandler.infrastructure.pdf.SourceDocument;
import com.example.pdfhandler.infrastructure.pdf.SourceDocumentGroup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Application-layer merge engine: copies every page of N sources, in caller order, into one output.
 *
 * <p>A missing or unreadable source is skipped and recorded in the outcome. Only "no pages copied"
 * and "save failed" abort the merge; both are reported as a failed outcome that still lists every
 * source. Sources stay open until the output has been saved and closed.</p>
 */
@Service
public class PdfMergeService {

    private static final Logger log = LoggerFactory.getLogger(PdfMergeService.class);
    private static final String PDF_EXTENSION = ".pdf";

    private final PdfDocumentGateway documentGateway;

    /**
     * Creates the service with the document handle abstraction.
     *
     * @param documentGateway opens sources and creates outputs
     */
    public PdfMergeService(PdfDocumentGateway documentGateway) {
        this.documentGateway = documentGateway;
    }

    public BatchOutcome merge(List<Path> sourcePaths, Path outputPath) {
        return merge(sourcePaths, outputPath, ProgressSink.none());
    }

    /**
     * Merges the given sources into {@code outputPath}.
     *
     * @param sourcePaths ordered sources; their order is the page order of the output
     * @param outputPath  file to write, parent directories are created when missing
     * @param progress    receives one percentage per attempted source
     * @return outcome listing every source as succeeded, skipped or failed; {@code success} is false
     *         when no page could be copied (nothing is written) or when the output could not be saved
     * @throws InvalidBatchArgumentException when no source or no output path is given
     */
    public BatchOutcome merge(List<Path> sourcePaths, Path outputPath, ProgressSink progress) {
        if (sourcePaths == null || sourcePaths.isEmpty()) {
            throw new InvalidBatchArgumentException("Please choose at least one PDF to merge.");
        }
        if (outputPath == null) {
            throw new InvalidBatchArgumentException("Output path is required.");
        }

        log.info("Merging {} file(s) into {}", sourcePaths.size(), outputPath);
        ProgressTracker tracker = new ProgressTracker(progress, sourcePaths.size());
        List<ItemOutcome> items = new ArrayList<>(sourcePaths.size());

        // declaration order closes the output before the sources
        try (SourceDocumentGroup sources = new SourceDocumentGroup();
             OutputDocument output = documentGateway.create(outputPath)) {

            for (int i = 0; i < sourcePaths.size(); i++) {
                Path sourcePath = sourcePaths.get(i);
                log.debug("[{}/{}] {}", i + 1, sourcePaths.size(), sourcePath);
                items.add(appendSource(sourcePath, output, sources));
                tracker.completed(i + 1);
            }

            if (output.pageCount() == 0) {
                log.error("Merge into {} aborted: no pages could be copied", outputPath);
                return BatchOutcome.failed(BatchKind.MERGE,
                        "No pages could be merged from " + sourcePaths.size() + " source file(s).", items);
            }

            try {
                output.save();
            } catch (PdfSaveException e) {
                log.error("Merge into {} aborted: output could not be saved", outputPath, e);
                return BatchOutcome.failed(BatchKind.MERGE, e.getMessage(), items);
            }
            log.info("Merged {} page(s) from {} of {} file(s) into {}",
                    output.pageCount(), sources.size(), sourcePaths.size(), outputPath);
            return BatchOutcome.completed(BatchKind.MERGE, items, List.of(outputPath));
        }
    }

    /**
     * Copies all pages of one source. On failure the pages already appended for this source are
     * removed again and the source is released.
     */
    private ItemOutcome appendSource(Path sourcePath, OutputDocument output, SourceDocumentGroup sources) {
        String item = String.valueOf(sourcePath);
        if (sourcePath == null || !Files.isRegularFile(sourcePath)) {
            log.warn("Skipping missing source {}", sourcePath);
            return ItemOutcome.skipped(item, "File not found");
        }

        int firstPageIndex = output.pageCount();
        SourceDocument source = null;
        try {
            source = documentGateway.open(sourcePath);
            int pageCount = source.pageCount();
            for (int pageIndex = 0; pageIndex < pageCount; pageIndex++) {
                output.appendPage(source, pageIndex);
            }
            sources.add(source);
            return ItemOutcome.succeeded(item, null, pageCount);
        } catch (RuntimeException e) {
            log.warn("Skipping unreadable source {}", sourcePath, e);
            output.discardPagesFrom(firstPageIndex);
            if (source != null) {
                source.close();
            }
            return ItemOutcome.failed(item, e.getMessage());
        }
    }

    /**
     * Resolves the merged file path from a folder and an optional file name.
     * A blank name falls back to {@code defaultFileName}; {@code .pdf} is appended when missing.
     *
     * @param folder          destination folder
     * @param fileName        name typed by the user, may be blank
     * @param defaultFileName name used when {@code fileName} is blank
     * @return output path inside {@code folder}
     */
    public static Path resolveOutputPath(Path folder, String fileName, String defaultFileName) {
        String name = fileName == null || fileName.isBlank() ? defaultFileName : fileName.trim();
        if (!name.toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION)) {
            name = name + PDF_EXTENSION;
        }
        return folder.resolve(name);
    }
}
