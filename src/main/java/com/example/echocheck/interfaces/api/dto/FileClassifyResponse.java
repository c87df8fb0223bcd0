package com.example.echocheck.interfaces.api.dto;

import com.example.echocheck.domain.model.ExtractionResult;
import com.example.echocheck.domain.model.FileClassificationResult;
import com.example.echocheck.domain.model.StancePrediction;

/**
 * API-layer DTO returned by the file classification endpoint.
 *
 * @param prediction      predicted stance label
 * @param confidence      probability of the predicted label
 * @param probabilities   probability of every label
 * @param filename        sanitized upload filename
 * @param fileType        resolved kind: txt, pdf or docx
 * @param extractedLength number of characters that were classified
 */
public record FileClassifyResponse(
        String prediction,
        double confidence,
        ProbabilityScores probabilities,
        String filename,
        String fileType,
        int extractedLength
) {
    public static FileClassifyResponse from(FileClassificationResult result) {
        StancePrediction prediction = result.prediction();
        ExtractionResult extraction = result.extraction();
        return new FileClassifyResponse(
                prediction.stance().label(),
                prediction.confidence(),
                ProbabilityScores.from(prediction),
                extraction.safeFilename(),
                extraction.kind().wireValue(),
                extraction.text().codePointCount(0, extraction.text().length())
        );
    }
}
