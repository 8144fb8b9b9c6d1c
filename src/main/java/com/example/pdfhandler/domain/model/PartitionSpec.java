package com.example.pdfhandler.domain.model;

import com.example.pdfhandler.domain.exception.InvalidBatchArgumentException;
import com.example.pdfhandler.domain.exception.InvalidPageRangeException;

import java.util.List;

/**
 * Strategy and parameters for partitioning one source document into several outputs.
 */
public sealed interface PartitionSpec permits PartitionSpec.Ranges, PartitionSpec.SinglePage, PartitionSpec.Equal {

    /**
     * Batch kind reported in the outcome of a split driven by this spec.
     *
     * @return matching {@link BatchKind}
     */
    BatchKind kind();

    static Ranges ranges(List<PageRange> ranges) {
        return new Ranges(ranges);
    }

    static SinglePage singlePage() {
        return new SinglePage();
    }

    static Equal equal(int parts) {
        return new Equal(parts);
    }

    /**
     * Explicit, caller-ordered page ranges; one output per range.
     */
    record Ranges(List<PageRange> ranges) implements PartitionSpec {

        public Ranges {
            if (ranges == null || ranges.isEmpty()) {
                throw new InvalidPageRangeException("Please enter at least one page range.");
            }
            ranges = List.copyOf(ranges);
        }

        @Override
        public BatchKind kind() {
            return BatchKind.SPLIT_RANGES;
        }
    }

    /**
     * One output per source page.
     */
    record SinglePage() implements PartitionSpec {

        @Override
        public BatchKind kind() {
            return BatchKind.SPLIT_PAGES;
        }
    }

    /**
     * {@code parts} outputs of {@code ceil(totalPages / parts)} pages each; the last one may be shorter.
     */
    record Equal(int parts) implements PartitionSpec {

        public Equal {
            if (parts < 1) {
                throw new InvalidBatchArgumentException("Number of parts must be at least 1 but was " + parts);
            }
        }

        @Override
        public BatchKind kind() {
            return BatchKind.SPLIT_EQUAL;
        }
    }
}
