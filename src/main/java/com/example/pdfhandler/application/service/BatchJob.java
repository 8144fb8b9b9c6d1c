package com.example.pdfhandler.application.service;

import com.example.pdfhandler.domain.model.BatchKind;
import com.example.pdfhandler.domain.model.BatchOutcome;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on a batch submitted to the worker. Progress is updated by the worker thread and read by callers;
 * {@link #completion()} completes exactly once with the final outcome.
 */
public final class BatchJob {

    private final String id;
    private final BatchKind kind;
    private final Instant submittedAt;
    private final CompletableFuture<BatchOutcome> completion = new CompletableFuture<>();
    private volatile BatchJobStatus status = BatchJobStatus.QUEUED;
    private volatile int progress;
    private volatile Instant finishedAt;

    BatchJob(String id, BatchKind kind, Instant submittedAt) {
        this.id = id;
        this.kind = kind;
        this.submittedAt = submittedAt;
    }

    public String id() {
        return id;
    }

    public BatchKind kind() {
        return kind;
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    public BatchJobStatus status() {
        return status;
    }

    /**
     * Last reported percentage, 0 until the first item finished.
     */
    public int progress() {
        return progress;
    }

    /**
     * Time the job completed, empty while it is queued or running.
     */
    public Optional<Instant> finishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    public Optional<BatchOutcome> outcome() {
        return Optional.ofNullable(completion.getNow(null));
    }

    public CompletableFuture<BatchOutcome> completion() {
        return completion;
    }

    void markRunning() {
        status = BatchJobStatus.RUNNING;
    }

    void updateProgress(int percent) {
        if (percent > progress) {
            progress = percent;
        }
    }

    void complete(BatchOutcome outcome) {
        status = outcome.success() ? BatchJobStatus.COMPLETED : BatchJobStatus.FAILED;
        finishedAt = Instant.now();
        completion.complete(outcome);
    }
}
