package com.example.pdfhandler.interfaces.api;

import com.example.pdfhandler.application.exception.UseCaseValidationException;
import com.example.pdfhandler.application.service.BatchJob;
import com.example.pdfhandler.application.service.BatchJobService;
import com.example.pdfhandler.application.service.PdfInspectionService;
import com.example.pdfhandler.application.service.PdfMergeService;
import com.example.pdfhandler.domain.model.NamingPattern;
import com.example.pdfhandler.domain.model.PageRange;
import com.example.pdfhandler.domain.model.PartitionSpec;
import com.example.pdfhandler.domain.model.PdfFileInfo;
import com.example.pdfhandler.infrastructure.config.PdfHandlerProperties;
import com.example.pdfhandler.interfaces.api.dto.BatchJobResponse;
import com.example.pdfhandler.interfaces.api.dto.MergeRequest;
import com.example.pdfhandler.interfaces.api.dto.PdfInfoResponse;
import com.example.pdfhandler.interfaces.api.dto.SplitRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interfaces-layer controller that lets a client queue merges and splits and poll their progress.
 * Request defaults mirror the desktop dialogs: outputs go next to the source unless a folder is given.
 */
@Controller
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class BatchController {

    private final BatchJobService batchJobService;
    private final PdfInspectionService inspectionService;
    private final PdfHandlerProperties properties;

    /**
     * Creates the controller with the required application services.
     *
     * @param batchJobService   queues batches on the worker
     * @param inspectionService reads page counts and file details
     * @param properties        application settings, used for request defaults
     */
    public BatchController(BatchJobService batchJobService,
                           PdfInspectionService inspectionService,
                           PdfHandlerProperties properties) {
        this.batchJobService = batchJobService;
        this.inspectionService = inspectionService;
        this.properties = properties;
    }

    /**
     * Queues a merge of the listed sources.
     *
     * @param request sources and output location
     * @return 202 with the queued job
     */
    @PostMapping(path = "/merge", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<BatchJobResponse> merge(@RequestBody MergeRequest request) {
        if (request.sources() == null || request.sources().isEmpty()) {
            throw new UseCaseValidationException("Please choose at least one PDF to merge.");
        }
        List<Path> sources = request.sources().stream().map(source -> toPath(source, "source")).toList();
        Path folder = isBlank(request.outputFolder())
                ? parentOf(sources.get(0))
                : toPath(request.outputFolder(), "outputFolder");
        Path outputPath = PdfMergeService.resolveOutputPath(folder, request.fileName(), properties.merge().defaultFileName());

        BatchJob job = batchJobService.submitMerge(sources, outputPath);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(BatchJobResponse.from(job));
    }

    /**
     * Queues a split of one source.
     *
     * @param request source, strategy and output location
     * @return 202 with the queued job
     */
    @PostMapping(path = "/split", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<BatchJobResponse> split(@RequestBody SplitRequest request) {
        if (isBlank(request.source())) {
            throw new UseCaseValidationException("Please choose the PDF to split.");
        }
        Path source = toPath(request.source(), "source");
        PartitionSpec spec = toPartitionSpec(request);
        Path folder = isBlank(request.outputFolder())
                ? parentOf(source)
                : toPath(request.outputFolder(), "outputFolder");
        NamingPattern pattern = isBlank(request.namingPattern())
                ? NamingPattern.forSource(source)
                : NamingPattern.of(request.namingPattern().trim());

        BatchJob job = batchJobService.submitSplit(source, spec, folder, pattern);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(BatchJobResponse.from(job));
    }

    /**
     * Returns status, progress and, once finished, the outcome of a job.
     *
     * @param jobId id returned on submission
     * @return job view
     */
    @GetMapping("/jobs/{jobId}")
    @ResponseBody
    public ResponseEntity<BatchJobResponse> job(@PathVariable String jobId) {
        return ResponseEntity.ok(BatchJobResponse.from(batchJobService.get(jobId)));
    }

    /**
     * Returns page count and file details of a PDF. When {@code ranges} is given, every range is
     * also checked against the page count and an out-of-bounds range is answered with 400.
     *
     * @param path   PDF on disk
     * @param ranges optional range list such as {@code "1-3, 4-7"}
     * @return file info
     */
    @GetMapping("/pdf/info")
    @ResponseBody
    public ResponseEntity<PdfInfoResponse> info(@RequestParam("path") String path,
                                                @RequestParam(name = "ranges", required = false) String ranges) {
        Path pdfPath = toPath(path, "path");
        PdfFileInfo info = isBlank(ranges)
                ? inspectionService.inspect(pdfPath)
                : inspectionService.validateRanges(pdfPath, PageRange.parseList(ranges));
        return ResponseEntity.ok(PdfInfoResponse.from(info));
    }

    private PartitionSpec toPartitionSpec(SplitRequest request) {
        if (request.mode() == null) {
            throw new UseCaseValidationException("Please choose a split mode (RANGES, SINGLE_PAGE or EQUAL).");
        }
        return switch (request.mode()) {
            case RANGES -> PartitionSpec.ranges(PageRange.parseList(request.ranges()));
            case SINGLE_PAGE -> PartitionSpec.singlePage();
            case EQUAL -> {
                if (request.parts() == null) {
                    throw new UseCaseValidationException("Please enter the number of parts.");
                }
                yield PartitionSpec.equal(request.parts());
            }
        };
    }

    private static Path toPath(String value, String field) {
        if (isBlank(value)) {
            throw new UseCaseValidationException("'" + field + "' must not be blank.");
        }
        try {
            return Path.of(value.trim());
        } catch (InvalidPathException ex) {
            throw new UseCaseValidationException("'" + field + "' is not a valid path: " + value);
        }
    }

    private static Path parentOf(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        return parent != null ? parent : file.toAbsolutePath();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
