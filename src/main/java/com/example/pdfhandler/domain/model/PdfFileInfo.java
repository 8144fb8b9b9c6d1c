package com.example.pdfhandler.domain.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;

/**
 * Summary of a PDF on disk, used by callers to validate split ranges and label files.
 */
public record PdfFileInfo(
        Path path,
        String fileName,
        long fileSizeBytes,
        Instant lastModified,
        int pageCount,
        String title,
        String author
) {

    /**
     * Human readable size such as {@code 512 B}, {@code 1.5 KB} or {@code 2.0 MB}.
     *
     * @return formatted size
     */
    public String formattedFileSize() {
        if (fileSizeBytes < 1024) {
            return fileSizeBytes + " B";
        }
        if (fileSizeBytes < 1024 * 1024) {
            return String.format(Locale.ROOT, "%.1f KB", fileSizeBytes / 1024.0);
        }
        if (fileSizeBytes < 1024L * 1024 * 1024) {
            return String.format(Locale.ROOT, "%.1f MB", fileSizeBytes / (1024.0 * 1024.0));
        }
        return String.format(Locale.ROOT, "%.1f GB", fileSizeBytes / (1024.0 * 1024.0 * 1024.0));
    }
}
