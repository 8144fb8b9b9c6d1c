package com.example.pdfhandler.application.service;

/**
 * Lifecycle of a submitted batch job.
 */
public enum BatchJobStatus {
    QUEUED,
    RUNNING,
    /** The batch ran; individual items may still have failed. */
    COMPLETED,
    /** The batch was aborted by a fatal failure. */
    FAILED
}
