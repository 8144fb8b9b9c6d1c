package com.example.pdfhandler.domain.model;

/**
 * One output file a split intends to produce: its sequence number for the naming pattern and
 * the source pages it covers.
 */
public record PlannedPart(int sequenceNumber, PageRange range) {
}
