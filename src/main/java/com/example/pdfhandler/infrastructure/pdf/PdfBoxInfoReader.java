package com.example.pdfhandler.infrastructure.pdf;

import com.example.pdfhandler.domain.model.PdfFileInfo;
import com.example.pdfhandler.infrastructure.exception.PdfOpenException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Infrastructure reader that turns a PDF on disk into a {@link PdfFileInfo}.
 * The file is copied into memory before parsing so that no lock is kept on it.
 */
@Component
public class PdfBoxInfoReader {

    /**
     * Reads file attributes, page count and the info dictionary title/author.
     *
     * @param path existing PDF file
     * @return populated file info
     * @throws PdfOpenException when the file cannot be read or parsed
     */
    public PdfFileInfo read(Path path) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            byte[] bytes = Files.readAllBytes(path);
            try (PDDocument document = Loader.loadPDF(bytes)) {
                PDDocumentInformation info = document.getDocumentInformation();
                return new PdfFileInfo(
                        path,
                        path.getFileName() != null ? path.getFileName().toString() : path.toString(),
                        attributes.size(),
                        attributes.lastModifiedTime().toInstant(),
                        document.getNumberOfPages(),
                        info != null ? info.getTitle() : null,
                        info != null ? info.getAuthor() : null
                );
            }
        } catch (IOException e) {
            throw new PdfOpenException(path, e);
        }
    }
}
