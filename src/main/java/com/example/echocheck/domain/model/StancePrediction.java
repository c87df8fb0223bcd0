package com.example.echocheck.domain.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Classifier answer for one piece of text.
 *
 * @param stance        most probable label
 * @param confidence    probability of {@code stance}
 * @param probabilities probability per label, summing to roughly one
 */
public record StancePrediction(
        Stance stance,
        double confidence,
        Map<Stance, Double> probabilities
) {

    public StancePrediction {
        probabilities = Map.copyOf(probabilities);
    }

    /**
     * Builds a prediction from a full probability distribution, picking the most probable label.
     *
     * @param probabilities probability per label; labels missing from the map count as zero
     * @return prediction for the arg-max label
     */
    public static StancePrediction fromProbabilities(Map<Stance, Double> probabilities) {
        EnumMap<Stance, Double> complete = new EnumMap<>(Stance.class);
        for (Stance stance : Stance.values()) {
            complete.put(stance, probabilities.getOrDefault(stance, 0.0));
        }
        Stance best = Stance.CENTER;
        for (Map.Entry<Stance, Double> entry : complete.entrySet()) {
            if (entry.getValue() > complete.get(best)) {
                best = entry.getKey();
            }
        }
        return new StancePrediction(best, complete.get(best), complete);
    }

    public double probabilityOf(Stance stance) {
        return probabilities.getOrDefault(stance, 0.0);
    }
}
