package com.example.pdfhandler.interfaces.api.dto;

import com.example.pdfhandler.application.service.BatchJob;
import com.example.pdfhandler.application.service.BatchJobStatus;
import com.example.pdfhandler.domain.model.BatchKind;

import java.time.Instant;

/**
 * JSON view of a submitted batch job; {@code outcome} is {@code null} while the job is queued or running.
 */
public record BatchJobResponse(
        String id,
        BatchKind kind,
        BatchJobStatus status,
        int progress,
        Instant submittedAt,
        BatchOutcomeResponse outcome
) {

    public static BatchJobResponse from(BatchJob job) {
        return new BatchJobResponse(
                job.id(),
                job.kind(),
                job.status(),
                job.progress(),
                job.submittedAt(),
                job.outcome().map(BatchOutcomeResponse::from).orElse(null)
        );
    }
}
