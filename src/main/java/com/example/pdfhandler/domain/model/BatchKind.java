package com.example.pdfhandler.domain.model;

/**
 * Kind of batch operation, used for logging and in {@link BatchOutcome}.
 */
public enum BatchKind {
    MERGE,
    SPLIT_RANGES,
    SPLIT_PAGES,
    SPLIT_EQUAL
}
