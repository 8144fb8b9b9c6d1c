package com.example.pdfhandler.application.service;

import com.example.pdfhandler.application.progress.ProgressSink;
import com.example.pdfhandler.application.progress.ProgressTracker;
import com.example.pdfhandler.domain.exception.InvalidBatchArgumentException;
import com.example.pdfhandler.domain.exception.InvalidPageRangeException;
import com.example.pdfhandler.domain.exception.PdfNotFoundException;
import com.example.pdfhandler.domain.model.BatchOutcome;
import com.example.pdfhandler.domain.model.ItemOutcome;
import com.example.pdfhandler.domain.model.NamingPattern;
import com.example.pdfhandler.domain.model.PageRange;
import com.example.pdfhandler.domain.model.PartitionSpec;
import com.example.pdfhandler.domain.model.PlannedPart;
import com.example.pdfhandler.domain.model.SplitPlan;
import com.example.pdfhandler.infrastructure.exception.OutputFolderUnavailableException;
import com.example.pdfhandler.infrastructure.exception.PdfOpenException;
import com.example.pdfhandler.infrastructure.pdf.OutputDocument;
import com.example.pdfhandler.infrastructure.pdf.PdfDocumentGateway;
import com.example.pdfhandler.infrastructure.pdf.SourceDocument;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Application-layer split engine: writes one source document out as several part files.
 *
 * <p>The source is opened once per call and closed exactly once at the end. Each part gets its own
 * short-lived output document. A part that cannot be written is recorded as failed and the split
 * continues with the next part.</p>
 */
@Service
public class PdfSplitService {

    private static final Logger log = LoggerFactory.getLogger(PdfSplitService.class);

    private final PdfDocumentGateway documentGateway;
    private final SplitPlanner splitPlanner;

    /**
     * Creates the service with its collaborators.
     *
     * @param documentGateway opens the source and creates part outputs
     * @param splitPlanner    computes the parts for a partition spec
     */
    public PdfSplitService(PdfDocumentGateway documentGateway, SplitPlanner splitPlanner) {
        this.documentGateway = documentGateway;
        this.splitPlanner = splitPlanner;
    }

    /**
     * Writes one file per range; the sequence number is the range's 1-based position.
     *
     * @see #split(Path, PartitionSpec, Path, NamingPattern, ProgressSink)
     */
    public BatchOutcome splitByRanges(Path sourcePath, List<PageRange> ranges, Path outputFolder,
                                      NamingPattern namingPattern, ProgressSink progress) {
        return split(sourcePath, PartitionSpec.ranges(ranges), outputFolder, namingPattern, progress);
    }

    /**
     * Writes one single-page file per source page, numbered by page.
     *
     * @see #split(Path, PartitionSpec, Path, NamingPattern, ProgressSink)
     */
    public BatchOutcome splitByPage(Path sourcePath, Path outputFolder,
                                    NamingPattern namingPattern, ProgressSink progress) {
        return split(sourcePath, PartitionSpec.singlePage(), outputFolder, namingPattern, progress);
    }

    /**
     * Writes up to {@code parts} files of {@code ceil(pages / parts)} pages each.
     *
     * @see #split(Path, PartitionSpec, Path, NamingPattern, ProgressSink)
     */
    public BatchOutcome splitEqually(Path sourcePath, int parts, Path outputFolder,
                                     NamingPattern namingPattern, ProgressSink progress) {
        return split(sourcePath, PartitionSpec.equal(parts), outputFolder, namingPattern, progress);
    }

    /**
     * Shared envelope for the three split strategies.
     *
     * @param sourcePath    PDF to split
     * @param spec          partition strategy
     * @param outputFolder  destination folder, created when missing
     * @param namingPattern part file name template
     * @param progress      receives one percentage per attempted part
     * @return outcome listing every attempted part
     * @throws InvalidBatchArgumentException     when an argument is missing
     * @throws PdfNotFoundException              when {@code sourcePath} does not exist
     * @throws OutputFolderUnavailableException  when the output folder cannot be created
     * @throws PdfOpenException                  when the source cannot be parsed
     * @throws InvalidPageRangeException         when a range exceeds the source page count
     */
    public BatchOutcome split(Path sourcePath, PartitionSpec spec, Path outputFolder,
                              NamingPattern namingPattern, ProgressSink progress) {
        if (sourcePath == null) {
            throw new InvalidBatchArgumentException("Source PDF path is required.");
        }
        if (spec == null) {
            throw new InvalidBatchArgumentException("Split mode is required.");
        }
        if (outputFolder == null) {
            throw new InvalidBatchArgumentException("Output folder is required.");
        }
        if (namingPattern == null) {
            throw new InvalidBatchArgumentException("File name pattern is required.");
        }
        if (!Files.isRegularFile(sourcePath)) {
            throw new PdfNotFoundException(sourcePath);
        }
        ensureFolder(outputFolder);

        try (SourceDocument source = documentGateway.open(sourcePath)) {
            int totalPages = source.pageCount();
            SplitPlan plan = splitPlanner.plan(spec, totalPages);
            log.info("Splitting {} ({} pages) as {} into {} part(s) under {}",
                    sourcePath.getFileName(), totalPages, spec.kind(), plan.parts().size(), outputFolder);

            ProgressTracker tracker = new ProgressTracker(progress, plan.progressTotal());
            List<ItemOutcome> items = new ArrayList<>(plan.parts().size());
            List<Path> outputs = new ArrayList<>(plan.parts().size());

            for (PlannedPart part : plan.parts()) {
                ItemOutcome outcome = writePart(source, part, outputFolder, namingPattern);
                items.add(outcome);
                if (outcome.isSucceeded()) {
                    outputs.add(outcome.output());
                }
                tracker.completed(part.sequenceNumber());
            }

            log.info("Split of {} finished: {} of {} part(s) written",
                    sourcePath.getFileName(), outputs.size(), plan.parts().size());
            return BatchOutcome.completed(spec.kind(), items, outputs);
        }
    }

    private ItemOutcome writePart(SourceDocument source, PlannedPart part, Path outputFolder, NamingPattern namingPattern) {
        Path target = namingPattern.resolve(outputFolder, part.sequenceNumber());
        String item = target.getFileName().toString();
        PageRange range = part.range();

        try (OutputDocument output = documentGateway.create(target)) {
            for (int pageNumber = range.start(); pageNumber <= range.end(); pageNumber++) {
                output.appendPage(source, pageNumber - 1);
            }
            output.save();
            log.debug("Wrote {} (pages {})", item, range);
            return ItemOutcome.succeeded(item, target, range.length());
        } catch (RuntimeException e) {
            log.warn("Failed to write {} (pages {})", item, range, e);
            return ItemOutcome.failed(item, e.getMessage());
        }
    }

    private void ensureFolder(Path outputFolder) {
        if (Files.isDirectory(outputFolder)) {
            return;
        }
        try {
            Files.createDirectories(outputFolder);
            log.debug("Created output folder {}", outputFolder);
        } catch (IOException e) {
            throw new OutputFolderUnavailableException(outputFolder, e);
        }
    }
}
