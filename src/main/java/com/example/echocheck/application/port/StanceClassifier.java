package com.example.echocheck.application.port;

import com.example.echocheck.domain.model.StancePrediction;

/**
 * Opaque text classifier consulted after ingestion.
 * Implementations may call a remote model; they must be safe to share across request threads.
 */
public interface StanceClassifier {

    /**
     * Predicts the stance of already sanitized text.
     *
     * @param text sanitized, length-bounded text
     * @return label, confidence and the full probability distribution
     */
    StancePrediction predict(String text);

    /**
     * @return identifier of the model behind this classifier
     */
    String modelName();
}
