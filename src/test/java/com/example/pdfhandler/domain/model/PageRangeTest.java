package com.example.pdfhandler.domain.model;

import com.example.pdfhandler.domain.exception.InvalidPageRangeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for page range construction and parsing.
 */
class PageRangeTest {

    @Test
    void rejectsStartBelowOne() {
        assertThrows(InvalidPageRangeException.class, () -> new PageRange(0, 3));
    }

    @Test
    void rejectsEndBeforeStart() {
        assertThrows(InvalidPageRangeException.class, () -> new PageRange(5, 4));
    }

    @Test
    void singlePageRangeHasLengthOne() {
        assertThat(new PageRange(4, 4).length()).isEqualTo(1);
    }

    /**
     * Ranges are not clamped to the document; a range past the last page is rejected.
     */
    @Test
    void requireWithinRejectsRangePastLastPage() {
        PageRange range = new PageRange(8, 12);

        range.requireWithin(12);
        assertThrows(InvalidPageRangeException.class, () -> range.requireWithin(11));
    }

    @Test
    void parseListKeepsInputOrderAndToleratesWhitespace() {
        List<PageRange> ranges = PageRange.parseList(" 11-20 ,1 - 10,5-5");

        assertThat(ranges).containsExactly(new PageRange(11, 20), new PageRange(1, 10), new PageRange(5, 5));
    }

    @Test
    void parseListRejectsMalformedItems() {
        assertThrows(InvalidPageRangeException.class, () -> PageRange.parseList("1-3, 7"));
        assertThrows(InvalidPageRangeException.class, () -> PageRange.parseList("1-3,,4-5"));
        assertThrows(InvalidPageRangeException.class, () -> PageRange.parseList("a-b"));
        assertThrows(InvalidPageRangeException.class, () -> PageRange.parseList("   "));
    }

    @Test
    void parseListRejectsReversedRange() {
        assertThrows(InvalidPageRangeException.class, () -> PageRange.parseList("1-3, 9-4"));
    }
}
