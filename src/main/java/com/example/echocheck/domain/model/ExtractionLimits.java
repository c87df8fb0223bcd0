package com.example.echocheck.domain.model;

import java.util.Set;

/**
 * Read-only resource limits applied by the ingestion pipeline.
 * Built once at startup and shared by every extraction component.
 *
 * @param allowedExtensions    lowercase extensions, dot included, that uploads may carry
 * @param maxUploadBytes       largest accepted upload body
 * @param maxPdfPages          largest accepted PDF page count
 * @param maxDocxParagraphs    number of Word body paragraphs read before extraction stops
 * @param maxDecompressedBytes largest declared uncompressed size of a Word archive
 * @param minTextLength        shortest accepted sanitized text
 * @param maxTextLength        length the sanitized text is cut to
 */
public record ExtractionLimits(
        Set<String> allowedExtensions,
        long maxUploadBytes,
        int maxPdfPages,
        int maxDocxParagraphs,
        long maxDecompressedBytes,
        int minTextLength,
        int maxTextLength
) {

    public static final long DEFAULT_MAX_UPLOAD_BYTES = 10L * 1024 * 1024;
    public static final int DEFAULT_MAX_PDF_PAGES = 500;
    public static final int DEFAULT_MAX_DOCX_PARAGRAPHS = 10_000;
    public static final long DEFAULT_MAX_DECOMPRESSED_BYTES = 50L * 1024 * 1024;
    public static final int DEFAULT_MIN_TEXT_LENGTH = 10;
    public static final int DEFAULT_MAX_TEXT_LENGTH = 50_000;

    public ExtractionLimits {
        allowedExtensions = Set.copyOf(allowedExtensions);
        if (maxUploadBytes <= 0 || maxPdfPages <= 0 || maxDocxParagraphs <= 0 || maxDecompressedBytes <= 0) {
            throw new IllegalArgumentException("Extraction limits must be positive.");
        }
        if (minTextLength < 0 || maxTextLength < minTextLength) {
            throw new IllegalArgumentException("Text length bounds are inconsistent: min="
                    + minTextLength + ", max=" + maxTextLength);
        }
    }

    /**
     * @return limits matching the documented defaults
     */
    public static ExtractionLimits defaults() {
        return new ExtractionLimits(
                Set.of(FileKind.TEXT.extension(), FileKind.PDF.extension(), FileKind.DOCX.extension()),
                DEFAULT_MAX_UPLOAD_BYTES,
                DEFAULT_MAX_PDF_PAGES,
                DEFAULT_MAX_DOCX_PARAGRAPHS,
                DEFAULT_MAX_DECOMPRESSED_BYTES,
                DEFAULT_MIN_TEXT_LENGTH,
                DEFAULT_MAX_TEXT_LENGTH
        );
    }

    /**
     * @return upload limit expressed in whole megabytes, for user-facing messages
     */
    public long maxUploadMegabytes() {
        return maxUploadBytes / (1024 * 1024);
    }
}
