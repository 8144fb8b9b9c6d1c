package com.example.pdfhandler.interfaces.api.dto;

import com.example.pdfhandler.domain.model.ItemOutcome;
import com.example.pdfhandler.domain.model.ItemStatus;

/**
 * JSON view of one batch item.
 */
public record ItemResponse(
        String item,
        ItemStatus status,
        String output,
        int pages,
        String message
) {

    public static ItemResponse from(ItemOutcome outcome) {
        return new ItemResponse(
                outcome.item(),
                outcome.status(),
                outcome.output() != null ? outcome.output().toString() : null,
                outcome.pages(),
                outcome.message()
        );
    }
}
