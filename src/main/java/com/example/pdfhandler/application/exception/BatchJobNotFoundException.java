package com.example.pdfhandler.application.exception;

/**
 * Raised when a caller polls for a batch job id that was never submitted.
 */
public class BatchJobNotFoundException extends ApplicationException {

    public BatchJobNotFoundException(String jobId) {
        super("Batch job not found: " + jobId);
    }
}
