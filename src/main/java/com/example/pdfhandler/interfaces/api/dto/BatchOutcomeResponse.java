package com.example.pdfhandler.interfaces.api.dto;

import com.example.pdfhandler.domain.model.BatchOutcome;

import java.nio.file.Path;
import java.util.List;

/**
 * JSON view of a finished batch, including the "X succeeded, Y failed" counts.
 */
public record BatchOutcomeResponse(
        boolean success,
        String message,
        long succeeded,
        long failed,
        long skipped,
        int partsProduced,
        List<String> outputs,
        List<ItemResponse> items
) {

    public static BatchOutcomeResponse from(BatchOutcome outcome) {
        return new BatchOutcomeResponse(
                outcome.success(),
                outcome.message(),
                outcome.succeededCount(),
                outcome.failedCount(),
                outcome.skippedCount(),
                outcome.partsProduced(),
                outcome.outputs().stream().map(Path::toString).toList(),
                outcome.items().stream().map(ItemResponse::from).toList()
        );
    }
}
