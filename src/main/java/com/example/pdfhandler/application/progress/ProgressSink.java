package com.example.pdfhandler.application.progress;

/**
 * Receives integer progress percentages (0 to 100) from a running batch.
 * Use {@link #none()} when the caller does not track progress.
 */
@FunctionalInterface
public interface ProgressSink {

    void report(int percent);

    static ProgressSink none() {
        return percent -> {
        };
    }
}
