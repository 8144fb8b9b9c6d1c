package com.example.pdfhandler.interfaces.api.dto;

/**
 * Split request body.
 *
 * @param source        PDF to split
 * @param mode          split strategy
 * @param ranges        range list such as {@code "1-3, 4-7"}, required for {@link SplitMode#RANGES}
 * @param parts         number of parts, required for {@link SplitMode#EQUAL}
 * @param outputFolder  destination folder; defaults to the folder of the source
 * @param namingPattern file name template containing {@code [N]}; defaults to {@code <source>_[N].pdf}
 */
public record SplitRequest(
        String source,
        SplitMode mode,
        String ranges,
        Integer parts,
        String outputFolder,
        String namingPattern
) {
}
