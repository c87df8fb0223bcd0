package com.example.echocheck.domain.model;

/**
 * Outcome of a successful ingestion run: sanitized, length-bounded text plus the facts
 * the pipeline established about the upload.
 * Returned from {@code DocumentExtractionService} to callers; never persisted.
 *
 * @param text         sanitized text, between the configured minimum and maximum length
 * @param kind         kind resolved from the sanitized filename
 * @param safeFilename sanitized basename of the uploaded file
 */
public record ExtractionResult(
        String text,
        FileKind kind,
        String safeFilename
) {
}
