package com.example.pdfhandler.application.service;

import com.example.pdfhandler.TestPdfs;
import com.example.pdfhandler.domain.exception.InvalidPageRangeException;
import com.example.pdfhandler.domain.exception.PdfNotFoundException;
import com.example.pdfhandler.domain.model.PageRange;
import com.example.pdfhandler.domain.model.PdfFileInfo;
import com.example.pdfhandler.infrastructure.exception.PdfOpenException;
import com.example.pdfhandler.infrastructure.pdf.PdfBoxInfoReader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for reading file details and pre-flight range checks.
 */
class PdfInspectionServiceTest {

    private final PdfInspectionService inspectionService = new PdfInspectionService(new PdfBoxInfoReader());

    @TempDir
    Path tempDir;

    /**
     * Verifies that page count, size and info dictionary entries are reported.
     *
     * @throws IOException when the fixture cannot be written
     */
    @Test
    void readsPageCountAndInfoDictionary() throws IOException {
        Path path = tempDir.resolve("annual.pdf");
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage());
            document.addPage(new PDPage());
            PDDocumentInformation info = new PDDocumentInformation();
            info.setTitle("Annual Report");
            info.setAuthor("Finance");
            document.setDocumentInformation(info);
            document.save(path.toFile());
        }

        PdfFileInfo fileInfo = inspectionService.inspect(path);

        assertThat(fileInfo.fileName()).isEqualTo("annual.pdf");
        assertThat(fileInfo.pageCount()).isEqualTo(2);
        assertThat(fileInfo.title()).isEqualTo("Annual Report");
        assertThat(fileInfo.author()).isEqualTo("Finance");
        assertThat(fileInfo.fileSizeBytes()).isEqualTo(Files.size(path));
    }

    @Test
    void missingFileIsReported() {
        assertThrows(PdfNotFoundException.class, () -> inspectionService.inspect(tempDir.resolve("missing.pdf")));
    }

    @Test
    void unreadableFileIsReported() throws IOException {
        Path garbage = TestPdfs.garbage(tempDir.resolve("garbage.pdf"));

        assertThrows(PdfOpenException.class, () -> inspectionService.inspect(garbage));
    }

    @Test
    void validatesRangesAgainstPageCount() throws IOException {
        Path path = TestPdfs.create(tempDir.resolve("five.pdf"), 5, 100);

        assertThat(inspectionService.validateRanges(path, PageRange.parseList("1-2, 3-5")).pageCount()).isEqualTo(5);
        assertThrows(InvalidPageRangeException.class,
                () -> inspectionService.validateRanges(path, List.of(new PageRange(4, 6))));
    }
}
