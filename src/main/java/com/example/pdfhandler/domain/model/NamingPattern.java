package com.example.pdfhandler.domain.model;

import com.example.pdfhandler.domain.exception.InvalidNamingPatternException;

import java.nio.file.Path;
import java.util.Locale;

/**
 * File name template for split outputs. Every {@value #PLACEHOLDER} token is replaced with the
 * part's sequence number, zero padded to at least three digits.
 */
public record NamingPattern(String pattern) {

    public static final String PLACEHOLDER = "[N]";

    public NamingPattern {
        if (pattern == null || pattern.isBlank() || !pattern.contains(PLACEHOLDER)) {
            throw new InvalidNamingPatternException(pattern);
        }
    }

    public static NamingPattern of(String pattern) {
        return new NamingPattern(pattern);
    }

    /**
     * Builds the default pattern {@code <base name>_[N].pdf} for a source file.
     *
     * @param source source PDF path
     * @return pattern derived from the source file name
     */
    public static NamingPattern forSource(Path source) {
        String fileName = source.getFileName() != null ? source.getFileName().toString() : "document.pdf";
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        return new NamingPattern(baseName + "_" + PLACEHOLDER + ".pdf");
    }

    /**
     * Renders the file name for a sequence number, e.g. 7 becomes {@code 007} and 1234 stays {@code 1234}.
     *
     * @param sequenceNumber 1-based sequence number
     * @return file name with every placeholder substituted
     */
    public String render(int sequenceNumber) {
        return pattern.replace(PLACEHOLDER, String.format(Locale.ROOT, "%03d", sequenceNumber));
    }

    public Path resolve(Path folder, int sequenceNumber) {
        return folder.resolve(render(sequenceNumber));
    }
}
