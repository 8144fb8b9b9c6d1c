package com.example.pdfhandler.application.service;

import com.example.pdfhandler.application.exception.BatchJobNotFoundException;
import com.example.pdfhandler.application.exception.BatchQueueFullException;
import com.example.pdfhandler.application.progress.ProgressSink;
import com.example.pdfhandler.domain.exception.InvalidBatchArgumentException;
import com.example.pdfhandler.domain.exception.PdfNotFoundException;
import com.example.pdfhandler.domain.model.BatchKind;
import com.example.pdfhandler.domain.model.BatchOutcome;
import com.example.pdfhandler.domain.model.ItemOutcome;
import com.example.pdfhandler.domain.model.ItemStatus;
import com.example.pdfhandler.domain.model.NamingPattern;
import com.example.pdfhandler.domain.model.PartitionSpec;
import com.example.pdfhandler.infrastructure.exception.PdfSaveException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;

/**
 * Tests job bookkeeping around the engines, running batches synchronously on the calling thread.
 */
class BatchJobServiceTest {

    private final Path source = Path.of("/data/a.pdf");
    private final Path output = Path.of("/data/merged.pdf");

    private PdfMergeService mergeService;
    private PdfSplitService splitService;
    private BatchJobService batchJobService;

    @BeforeEach
    void setUp() {
        mergeService = mock(PdfMergeService.class);
        splitService = mock(PdfSplitService.class);
        batchJobService = new BatchJobService(mergeService, splitService, new SyncTaskExecutor());
    }

    /**
     * Verifies that progress reported by the engine reaches the job and the outcome completes it.
     */
    @Test
    void completedMergeExposesProgressAndOutcome() {
        BatchOutcome outcome = BatchOutcome.completed(BatchKind.MERGE,
                List.of(ItemOutcome.succeeded(source.toString(), null, 4)), List.of(output));
        BDDMockito.given(mergeService.merge(eq(List.of(source)), eq(output), any(ProgressSink.class)))
                .willAnswer(invocation -> {
                    ProgressSink sink = invocation.getArgument(2);
                    sink.report(40);
                    sink.report(100);
                    return outcome;
                });

        BatchJob job = batchJobService.submitMerge(List.of(source), output);

        assertThat(job.kind()).isEqualTo(BatchKind.MERGE);
        assertThat(job.status()).isEqualTo(BatchJobStatus.COMPLETED);
        assertThat(job.progress()).isEqualTo(100);
        assertThat(job.outcome()).contains(outcome);
        assertThat(job.completion()).isCompletedWithValue(outcome);
        assertThat(batchJobService.get(job.id())).isSameAs(job);
    }

    /**
     * A merge that copied no pages fails the job and keeps the per-source results.
     */
    @Test
    void failedMergeKeepsPerSourceItems() {
        BatchOutcome failed = BatchOutcome.failed(BatchKind.MERGE, "No pages could be merged from 2 source file(s).", List.of(
                ItemOutcome.failed(source.toString(), "Unable to open PDF /data/a.pdf"),
                ItemOutcome.skipped("/data/b.pdf", "File not found")));
        BDDMockito.given(mergeService.merge(any(), any(), any())).willReturn(failed);

        BatchJob job = batchJobService.submitMerge(List.of(source, Path.of("/data/b.pdf")), output);

        assertThat(job.status()).isEqualTo(BatchJobStatus.FAILED);
        BatchOutcome outcome = job.outcome().orElseThrow();
        assertThat(outcome.success()).isFalse();
        assertThat(outcome.message()).isEqualTo("No pages could be merged from 2 source file(s).");
        assertThat(outcome.items()).extracting(ItemOutcome::status).containsExactly(ItemStatus.FAILED, ItemStatus.SKIPPED);
    }

    @Test
    void domainFailureCompletesJobAsFailed() {
        BDDMockito.given(mergeService.merge(any(), any(), any()))
                .willThrow(new InvalidBatchArgumentException("Output path is required."));

        BatchJob job = batchJobService.submitMerge(List.of(source), output);

        assertThat(job.status()).isEqualTo(BatchJobStatus.FAILED);
        assertThat(job.outcome().orElseThrow().message()).isEqualTo("Output path is required.");
    }

    /**
     * An Error thrown by the engine still completes the job, then propagates to the worker.
     */
    @Test
    void errorStillCompletesJob() {
        List<Runnable> queued = new ArrayList<>();
        BatchJobService deferred = new BatchJobService(mergeService, splitService, queued::add);
        BDDMockito.given(mergeService.merge(any(), any(), any())).willThrow(new OutOfMemoryError("Java heap space"));

        BatchJob job = deferred.submitMerge(List.of(source), output);
        assertThat(job.status()).isEqualTo(BatchJobStatus.QUEUED);

        assertThrows(OutOfMemoryError.class, () -> queued.get(0).run());
        assertThat(job.status()).isEqualTo(BatchJobStatus.FAILED);
        assertThat(job.completion()).isDone();
        assertThat(job.outcome().orElseThrow().success()).isFalse();
        assertThat(job.finishedAt()).isPresent();
    }

    @Test
    void evictsOnlyFinishedJobsOlderThanCutoff() {
        BDDMockito.given(mergeService.merge(any(), any(), any()))
                .willReturn(BatchOutcome.completed(BatchKind.MERGE, List.of(), List.of(output)));
        List<Runnable> queued = new ArrayList<>();
        BatchJobService deferred = new BatchJobService(mergeService, splitService, queued::add);
        BatchJob finished = deferred.submitMerge(List.of(source), output);
        queued.get(0).run();
        BatchJob waiting = deferred.submitMerge(List.of(source), output);

        assertThat(deferred.evictFinishedBefore(finished.finishedAt().orElseThrow())).isZero();
        assertThat(deferred.evictFinishedBefore(Instant.now().plusSeconds(1))).isEqualTo(1);

        assertThrows(BatchJobNotFoundException.class, () -> deferred.get(finished.id()));
        assertThat(deferred.get(waiting.id())).isSameAs(waiting);
    }

    @Test
    void infrastructureFailureCompletesJobAsFailed() {
        BDDMockito.given(mergeService.merge(any(), any(), any()))
                .willThrow(new PdfSaveException(output, new IOException("No space left on device")));

        BatchJob job = batchJobService.submitMerge(List.of(source), output);

        assertThat(job.status()).isEqualTo(BatchJobStatus.FAILED);
        assertThat(job.outcome().orElseThrow().message()).contains("merged.pdf");
    }

    @Test
    void splitJobUsesKindOfPartitionSpec() {
        PartitionSpec spec = PartitionSpec.equal(3);
        NamingPattern pattern = NamingPattern.of("a_[N].pdf");
        Path folder = Path.of("/data/parts");
        BDDMockito.given(splitService.split(eq(source), eq(spec), eq(folder), eq(pattern), any(ProgressSink.class)))
                .willThrow(new PdfNotFoundException(source));

        BatchJob job = batchJobService.submitSplit(source, spec, folder, pattern);

        assertThat(job.kind()).isEqualTo(BatchKind.SPLIT_EQUAL);
        assertThat(job.status()).isEqualTo(BatchJobStatus.FAILED);
        assertThat(job.outcome().orElseThrow().message()).startsWith("PDF not found");
    }

    @Test
    void unknownJobIdIsRejected() {
        assertThrows(BatchJobNotFoundException.class, () -> batchJobService.get("nope"));
        assertThrows(BatchJobNotFoundException.class, () -> batchJobService.get(null));
    }

    @Test
    void rejectedSubmissionIsReportedAndNotTracked() {
        BatchJobService rejecting = new BatchJobService(mergeService, splitService, task -> {
            throw new TaskRejectedException("queue full");
        });

        assertThrows(BatchQueueFullException.class, () -> rejecting.submitMerge(List.of(source), output));
    }
}
