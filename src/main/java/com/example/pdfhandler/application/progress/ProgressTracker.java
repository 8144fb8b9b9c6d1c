package com.example.pdfhandler.application.progress;

/**
 * Turns "items done out of total" into percentages for one batch call.
 *
 * <p>Values are {@code round(100 * done / total)}, clamped to 0..100 and never lower than the last
 * reported value. 100 is reported only once {@code done == total}; a rounded 100 before that is
 * reported as 99.</p>
 */
public final class ProgressTracker {

    private final ProgressSink sink;
    private final int total;
    private int lastReported = -1;

    public ProgressTracker(ProgressSink sink, int total) {
        this.sink = sink != null ? sink : ProgressSink.none();
        this.total = total;
    }

    /**
     * Reports progress after {@code done} items were attempted.
     *
     * @param done number of attempted items, successful or not
     */
    public void completed(int done) {
        int percent = percentOf(done, total);
        if (percent < lastReported) {
            percent = lastReported;
        }
        lastReported = percent;
        sink.report(percent);
    }

    public int lastReported() {
        return lastReported;
    }

    static int percentOf(int done, int total) {
        if (total <= 0) {
            return 100;
        }
        int bounded = Math.max(0, Math.min(done, total));
        int percent = (int) Math.round(100.0 * bounded / total);
        if (percent >= 100 && bounded < total) {
            return 99;
        }
        return percent;
    }
}
