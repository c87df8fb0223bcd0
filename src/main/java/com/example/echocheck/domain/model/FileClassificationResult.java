package com.example.echocheck.domain.model;

/**
 * Classification of an uploaded document together with the extraction it was computed from.
 */
public record FileClassificationResult(
        StancePrediction prediction,
        ExtractionResult extraction
) {
}
