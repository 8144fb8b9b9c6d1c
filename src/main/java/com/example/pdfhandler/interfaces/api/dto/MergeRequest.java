package com.example.pdfhandler.interfaces.api.dto;

import java.util.List;

/**
 * Merge request body.
 *
 * @param sources      source paths in output order
 * @param outputFolder destination folder; defaults to the folder of the first source
 * @param fileName     merged file name; defaults to the configured name, {@code .pdf} is appended when missing
 */
public record MergeRequest(
        List<String> sources,
        String outputFolder,
        String fileName
) {
}
