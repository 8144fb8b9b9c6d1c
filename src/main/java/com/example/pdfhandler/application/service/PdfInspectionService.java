package com.example.pdfhandler.application.service;

import com.example.pdfhandler.domain.exception.InvalidBatchArgumentException;
import com.example.pdfhandler.domain.exception.InvalidPageRangeException;
import com.example.pdfhandler.domain.exception.PdfNotFoundException;
import com.example.pdfhandler.domain.model.PageRange;
import com.example.pdfhandler.domain.model.PdfFileInfo;
import com.example.pdfhandler.infrastructure.exception.PdfOpenException;
import com.example.pdfhandler.infrastructure.pdf.PdfBoxInfoReader;

import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Application-layer service that answers questions about a PDF before a batch is started:
 * its page count and basic file details, and whether a set of ranges fits inside it.
 */
@Service
public class PdfInspectionService {

    private final PdfBoxInfoReader infoReader;

    public PdfInspectionService(PdfBoxInfoReader infoReader) {
        this.infoReader = infoReader;
    }

    /**
     * Reads file details and page count.
     *
     * @param pdfPath path pointing to a PDF file on disk
     * @return file info
     * @throws InvalidBatchArgumentException when {@code pdfPath} is null
     * @throws PdfNotFoundException          when the path does not exist
     * @throws PdfOpenException              when the file is not a readable PDF
     */
    public PdfFileInfo inspect(Path pdfPath) {
        if (pdfPath == null) {
            throw new InvalidBatchArgumentException("PDF path is required.");
        }
        if (!Files.isRegularFile(pdfPath)) {
            throw new PdfNotFoundException(pdfPath);
        }
        return infoReader.read(pdfPath);
    }

    /**
     * Reads the file and checks every range against its page count, so a range split can be
     * rejected before it is queued.
     *
     * @param pdfPath source PDF
     * @param ranges  ranges the caller intends to split by
     * @return file info of the document
     * @throws InvalidPageRangeException when a range ends after the last page
     */
    public PdfFileInfo validateRanges(Path pdfPath, List<PageRange> ranges) {
        PdfFileInfo info = inspect(pdfPath);
        ranges.forEach(range -> range.requireWithin(info.pageCount()));
        return info;
    }
}
