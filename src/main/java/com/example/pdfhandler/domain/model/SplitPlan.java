package com.example.pdfhandler.domain.model;

import java.util.List;

/**
 * Ordered parts a split will attempt, plus the denominator used for progress reporting.
 * For an equal split {@code progressTotal} is the requested part count even when fewer parts are planned.
 */
public record SplitPlan(List<PlannedPart> parts, int progressTotal) {

    public SplitPlan {
        parts = List.copyOf(parts);
    }
}
