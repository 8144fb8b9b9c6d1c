package com.example.pdfhandler.interfaces.api.dto;

/**
 * Split strategy as selected by the caller.
 */
public enum SplitMode {
    RANGES,
    SINGLE_PAGE,
    EQUAL
}
