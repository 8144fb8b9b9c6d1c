package com.example.pdfhandler.interfaces.api.dto;

import com.example.pdfhandler.domain.model.PdfFileInfo;

import java.time.Instant;

/**
 * JSON view of {@link PdfFileInfo}.
 */
public record PdfInfoResponse(
        String path,
        String fileName,
        long fileSizeBytes,
        String formattedFileSize,
        Instant lastModified,
        int pageCount,
        String title,
        String author
) {

    public static PdfInfoResponse from(PdfFileInfo info) {
        return new PdfInfoResponse(
                info.path().toString(),
                info.fileName(),
                info.fileSizeBytes(),
                info.formattedFileSize(),
                info.lastModified(),
                info.pageCount(),
                info.title(),
                info.author()
        );
    }
}
