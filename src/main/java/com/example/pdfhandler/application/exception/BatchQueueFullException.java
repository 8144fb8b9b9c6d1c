package com.example.pdfhandler.application.exception;

/**
 * Raised when the batch worker queue is full and a new merge or split cannot be accepted.
 */
public class BatchQueueFullException extends ApplicationException {

    public BatchQueueFullException(Throwable cause) {
        super("Too many batches are waiting. Please try again once the current ones have finished.", cause);
    }
}
