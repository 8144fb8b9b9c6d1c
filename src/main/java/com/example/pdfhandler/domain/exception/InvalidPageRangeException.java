package com.example.pdfhandler.domain.exception;

/**
 * Raised when a page range is malformed or does not fit inside the source document.
 * Ranges are never clamped; the whole split is rejected instead.
 */
public class InvalidPageRangeException extends InvalidBatchArgumentException {

    public InvalidPageRangeException(String message) {
        super(message);
    }
}
