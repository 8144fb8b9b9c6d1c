package com.example.pdfhandler.domain.model;

import com.example.pdfhandler.domain.exception.InvalidPageRangeException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Closed interval of 1-based page numbers, {@code 1 <= start <= end}.
 * The upper bound against a concrete document is checked with {@link #requireWithin(int)}.
 */
public record PageRange(int start, int end) {

    private static final Pattern RANGE_PATTERN = Pattern.compile("^(\\d+)\\s*-\\s*(\\d+)$");

    public PageRange {
        if (start < 1 || end < start) {
            throw new InvalidPageRangeException("Invalid page range: " + start + "-" + end
                    + " (start must be >= 1 and <= end)");
        }
    }

    /**
     * Number of pages covered by the range.
     *
     * @return {@code end - start + 1}
     */
    public int length() {
        return end - start + 1;
    }

    /**
     * Ensures the range fits inside a document with the given page count.
     *
     * @param totalPages page count of the source document
     * @throws InvalidPageRangeException when {@code end > totalPages}
     */
    public void requireWithin(int totalPages) {
        if (end > totalPages) {
            throw new InvalidPageRangeException("Page range " + this + " exceeds the document length of "
                    + totalPages + " page(s)");
        }
    }

    /**
     * Parses a comma separated list such as {@code "1-10, 11-20"}.
     * Every item must have the {@code start-end} form; order is preserved.
     *
     * @param text range list typed by the user
     * @return parsed ranges in input order
     * @throws InvalidPageRangeException when the text is blank or an item is malformed
     */
    public static List<PageRange> parseList(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidPageRangeException("Please enter at least one page range.");
        }
        List<PageRange> ranges = new ArrayList<>();
        for (String rawItem : text.split(",")) {
            String item = rawItem.trim();
            Matcher matcher = RANGE_PATTERN.matcher(item);
            if (!matcher.matches()) {
                throw new InvalidPageRangeException("Invalid page range format: '" + item + "' (expected e.g. 1-3, 4-7)");
            }
            try {
                ranges.add(new PageRange(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))));
            } catch (NumberFormatException ex) {
                throw new InvalidPageRangeException("Page number too large: '" + item + "'");
            }
        }
        return List.copyOf(ranges);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
