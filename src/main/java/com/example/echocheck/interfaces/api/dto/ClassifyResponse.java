package com.example.echocheck.interfaces.api.dto;

import com.example.echocheck.domain.model.StancePrediction;

/**
 * API-layer DTO returned by the text classification endpoint.
 *
 * @param prediction    predicted stance label: left, center or right
 * @param confidence    probability of the predicted label
 * @param probabilities probability of every label
 */
public record ClassifyResponse(
        String prediction,
        double confidence,
        ProbabilityScores probabilities
) {
    public static ClassifyResponse from(StancePrediction prediction) {
        return new ClassifyResponse(
                prediction.stance().label(),
                prediction.confidence(),
                ProbabilityScores.from(prediction)
        );
    }
}
