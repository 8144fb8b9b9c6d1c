package com.example.pdfhandler.domain.model;

import java.nio.file.Path;

/**
 * Per-item entry of a {@link BatchOutcome}.
 *
 * @param item    merge source path or split output file name
 * @param status  what happened to the item
 * @param output  file written for the item, {@code null} for merge sources and failed parts
 * @param pages   number of pages copied for the item
 * @param message failure or skip reason, {@code null} on success
 */
public record ItemOutcome(
        String item,
        ItemStatus status,
        Path output,
        int pages,
        String message
) {

    public static ItemOutcome succeeded(String item, Path output, int pages) {
        return new ItemOutcome(item, ItemStatus.SUCCEEDED, output, pages, null);
    }

    public static ItemOutcome skipped(String item, String reason) {
        return new ItemOutcome(item, ItemStatus.SKIPPED, null, 0, reason);
    }

    public static ItemOutcome failed(String item, String reason) {
        return new ItemOutcome(item, ItemStatus.FAILED, null, 0, reason);
    }

    public boolean isSucceeded() {
        return status == ItemStatus.SUCCEEDED;
    }
}
