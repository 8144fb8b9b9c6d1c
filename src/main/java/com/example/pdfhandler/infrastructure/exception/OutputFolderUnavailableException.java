package com.example.pdfhandler.infrastructure.exception;

import java.nio.file.Path;

/**
 * Signals that a split output folder is missing and could not be created.
 */
public class OutputFolderUnavailableException extends InfrastructureException {

    public OutputFolderUnavailableException(Path folder, Throwable cause) {
        super("Output folder is not available: " + folder, cause);
    }
}
