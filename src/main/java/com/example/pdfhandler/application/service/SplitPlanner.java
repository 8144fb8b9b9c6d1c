package com.example.pdfhandler.application.service;

import com.example.pdfhandler.domain.exception.InvalidPageRangeException;
import com.example.pdfhandler.domain.model.PageRange;
import com.example.pdfhandler.domain.model.PartitionSpec;
import com.example.pdfhandler.domain.model.PlannedPart;
import com.example.pdfhandler.domain.model.SplitPlan;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure logic that turns a {@link PartitionSpec} and a page count into the list of parts to write.
 * Keeps partitioning testable without opening any PDF.
 */
@Component
public class SplitPlanner {

    /**
     * Plans the parts of a split.
     *
     * @param spec       partition strategy
     * @param totalPages page count of the opened source
     * @return planned parts in output order
     * @throws InvalidPageRangeException when an explicit range exceeds {@code totalPages}
     */
    public SplitPlan plan(PartitionSpec spec, int totalPages) {
        if (spec instanceof PartitionSpec.Ranges ranges) {
            return planRanges(ranges.ranges(), totalPages);
        }
        if (spec instanceof PartitionSpec.SinglePage) {
            return planSinglePages(totalPages);
        }
        if (spec instanceof PartitionSpec.Equal equal) {
            return planEqualParts(equal.parts(), totalPages);
        }
        throw new IllegalArgumentException("Unsupported partition spec: " + spec);
    }

    private SplitPlan planRanges(List<PageRange> ranges, int totalPages) {
        // all ranges are checked before the first part is written
        ranges.forEach(range -> range.requireWithin(totalPages));

        List<PlannedPart> parts = new ArrayList<>(ranges.size());
        for (int i = 0; i < ranges.size(); i++) {
            parts.add(new PlannedPart(i + 1, ranges.get(i)));
        }
        return new SplitPlan(parts, ranges.size());
    }

    private SplitPlan planSinglePages(int totalPages) {
        List<PlannedPart> parts = new ArrayList<>(totalPages);
        for (int page = 1; page <= totalPages; page++) {
            parts.add(new PlannedPart(page, new PageRange(page, page)));
        }
        return new SplitPlan(parts, totalPages);
    }

    private SplitPlan planEqualParts(int requestedParts, int totalPages) {
        int pagesPerPart = pagesPerPart(totalPages, requestedParts);
        List<PlannedPart> parts = new ArrayList<>();
        for (int i = 0; i < requestedParts; i++) {
            int startPage = i * pagesPerPart + 1;
            if (startPage > totalPages) {
                break;
            }
            int endPage = Math.min((i + 1) * pagesPerPart, totalPages);
            parts.add(new PlannedPart(i + 1, new PageRange(startPage, endPage)));
        }
        return new SplitPlan(parts, requestedParts);
    }

    /**
     * {@code ceil(totalPages / parts)}.
     */
    static int pagesPerPart(int totalPages, int parts) {
        return (totalPages + parts - 1) / parts;
    }
}
