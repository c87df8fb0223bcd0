package com.example.echocheck.interfaces.api.dto;

import com.example.echocheck.domain.model.Stance;
import com.example.echocheck.domain.model.StancePrediction;

/**
 * Probability of each stance label, as serialized to clients.
 */
public record ProbabilityScores(
        double center,
        double left,
        double right
) {
    public static ProbabilityScores from(StancePrediction prediction) {
        return new ProbabilityScores(
                prediction.probabilityOf(Stance.CENTER),
                prediction.probabilityOf(Stance.LEFT),
                prediction.probabilityOf(Stance.RIGHT)
        );
    }
}
