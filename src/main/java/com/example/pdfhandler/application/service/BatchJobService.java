package com.example.pdfhandler.application.service;

import com.example.pdfhandler.application.exception.BatchJobNotFoundException;
import com.example.pdfhandler.application.exception.BatchQueueFullException;
import com.example.pdfhandler.application.progress.ProgressSink;
import com.example.pdfhandler.domain.exception.DomainException;
import com.example.pdfhandler.domain.model.BatchKind;
import com.example.pdfhandler.domain.model.BatchOutcome;
import com.example.pdfhandler.domain.model.NamingPattern;
import com.example.pdfhandler.domain.model.PartitionSpec;
import com.example.pdfhandler.infrastructure.config.BatchExecutorConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Runs merge and split batches on the dedicated batch worker and tracks them by id.
 *
 * <p>Fatal failures raised by the engines are turned into a failed {@link BatchOutcome}, so every
 * job completes exactly once, either with success or with failure.</p>
 */
@Service
public class BatchJobService {

    private static final Logger log = LoggerFactory.getLogger(BatchJobService.class);

    private final PdfMergeService mergeService;
    private final PdfSplitService splitService;
    private final TaskExecutor batchExecutor;
    private final Map<String, BatchJob> jobs = new ConcurrentHashMap<>();

    public BatchJobService(PdfMergeService mergeService,
                           PdfSplitService splitService,
                           @Qualifier(BatchExecutorConfig.BATCH_EXECUTOR) TaskExecutor batchExecutor) {
        this.mergeService = mergeService;
        this.splitService = splitService;
        this.batchExecutor = batchExecutor;
    }

    /**
     * Queues a merge.
     *
     * @param sourcePaths ordered sources
     * @param outputPath  merged file
     * @return job handle
     */
    public BatchJob submitMerge(List<Path> sourcePaths, Path outputPath) {
        List<Path> sources = List.copyOf(sourcePaths);
        return submit(BatchKind.MERGE, progress -> mergeService.merge(sources, outputPath, progress));
    }

    /**
     * Queues a split.
     *
     * @param sourcePath    PDF to split
     * @param spec          partition strategy
     * @param outputFolder  destination folder
     * @param namingPattern part file name template
     * @return job handle
     */
    public BatchJob submitSplit(Path sourcePath, PartitionSpec spec, Path outputFolder, NamingPattern namingPattern) {
        return submit(spec.kind(), progress -> splitService.split(sourcePath, spec, outputFolder, namingPattern, progress));
    }

    public BatchJob get(String jobId) {
        BatchJob job = jobId != null ? jobs.get(jobId) : null;
        if (job == null) {
            throw new BatchJobNotFoundException(jobId);
        }
        return job;
    }

    private BatchJob submit(BatchKind kind, Function<ProgressSink, BatchOutcome> batch) {
        BatchJob job = new BatchJob(UUID.randomUUID().toString(), kind, Instant.now());
        jobs.put(job.id(), job);
        try {
            batchExecutor.execute(() -> run(job, batch));
        } catch (TaskRejectedException e) {
            jobs.remove(job.id());
            throw new BatchQueueFullException(e);
        }
        log.info("Queued {} job {}", kind, job.id());
        return job;
    }

    /**
     * Drops finished jobs that completed before {@code cutoff}. Queued and running jobs are kept.
     *
     * @param cutoff jobs finished strictly before this instant are removed
     * @return number of evicted jobs
     */
    public int evictFinishedBefore(Instant cutoff) {
        int before = jobs.size();
        jobs.values().removeIf(job -> job.finishedAt().map(finished -> finished.isBefore(cutoff)).orElse(false));
        int evicted = before - jobs.size();
        if (evicted > 0) {
            log.debug("Evicted {} finished job(s) completed before {}", evicted, cutoff);
        }
        return evicted;
    }

    private void run(BatchJob job, Function<ProgressSink, BatchOutcome> batch) {
        job.markRunning();
        // replaced on every normal exit; only an Error leaves this value in place
        BatchOutcome outcome = BatchOutcome.failed(job.kind(), "Batch aborted by an unrecoverable error.", List.of());
        try {
            outcome = batch.apply(job::updateProgress);
        } catch (DomainException e) {
            log.warn("{} job {} rejected: {}", job.kind(), job.id(), e.getMessage());
            outcome = BatchOutcome.failed(job.kind(), e.getMessage(), List.of());
        } catch (RuntimeException e) {
            log.error("{} job {} failed", job.kind(), job.id(), e);
            outcome = BatchOutcome.failed(job.kind(), e.getMessage(), List.of());
        } finally {
            job.complete(outcome);
            log.info("{} job {} finished: success={}, succeeded={}, failed={}, skipped={}",
                    job.kind(), job.id(), outcome.success(),
                    outcome.succeededCount(), outcome.failedCount(), outcome.skippedCount());
        }
    }
}
