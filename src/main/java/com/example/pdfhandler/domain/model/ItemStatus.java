package com.example.pdfhandler.domain.model;

/**
 * Result of one item of a batch (a merge source or a split part).
 */
public enum ItemStatus {
    SUCCEEDED,
    /** Merge source that did not exist at call time. */
    SKIPPED,
    FAILED
}
