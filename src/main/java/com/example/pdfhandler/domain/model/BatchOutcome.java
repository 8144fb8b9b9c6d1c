package com.example.pdfhandler.domain.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of one merge or split call.
 * {@code success} is {@code false} only for fatal failures; per-item failures are listed in {@code items}.
 */
public record BatchOutcome(
        BatchKind kind,
        boolean success,
        List<ItemOutcome> items,
        List<Path> outputs,
        String message
) {

    public BatchOutcome {
        items = items == null ? List.of() : List.copyOf(items);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    /**
     * Outcome of a batch that ran to completion.
     *
     * @param kind    batch kind
     * @param items   per-item results in processing order
     * @param outputs files written by the batch
     * @return successful outcome
     */
    public static BatchOutcome completed(BatchKind kind, List<ItemOutcome> items, List<Path> outputs) {
        return new BatchOutcome(kind, true, items, outputs, null);
    }

    /**
     * Outcome of a batch aborted by a fatal failure.
     *
     * @param kind    batch kind
     * @param message reason shown to the user
     * @param items   per-item results gathered before the abort, may be empty
     * @return failed outcome without outputs
     */
    public static BatchOutcome failed(BatchKind kind, String message, List<ItemOutcome> items) {
        return new BatchOutcome(kind, false, items, List.of(), message);
    }

    public long succeededCount() {
        return count(ItemStatus.SUCCEEDED);
    }

    public long failedCount() {
        return count(ItemStatus.FAILED);
    }

    public long skippedCount() {
        return count(ItemStatus.SKIPPED);
    }

    /**
     * Number of output files actually written; for an equal split this may be lower than requested.
     *
     * @return size of {@link #outputs()}
     */
    public int partsProduced() {
        return outputs.size();
    }

    public boolean allItemsFailed() {
        return !items.isEmpty() && succeededCount() == 0;
    }

    private long count(ItemStatus status) {
        return items.stream().filter(item -> item.status() == status).count();
    }
}
