package com.example.echocheck.infrastructure.classifier;

import com.example.echocheck.application.port.StanceClassifier;
import com.example.echocheck.config.ClassifierProperties;
import com.example.echocheck.domain.model.Stance;
import com.example.echocheck.domain.model.StancePrediction;
import com.example.echocheck.infrastructure.exception.RemoteServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * {@link StanceClassifier} backed by a text-classification inference endpoint.
 * The endpoint receives {@code {"inputs": text}} and answers with {@code label}/{@code score} pairs,
 * either flat or nested one level deep.
 */
@Service
public class RemoteStanceClassifier implements StanceClassifier {

    /**
     * Positional labels emitted by models exported without an id-to-label mapping.
     */
    private static final Map<String, Stance> INDEXED_LABELS = Map.of(
            "label_0", Stance.CENTER,
            "label_1", Stance.LEFT,
            "label_2", Stance.RIGHT
    );

    private final RestClient restClient;
    private final String url;
    private final String modelName;

    public RemoteStanceClassifier(@Qualifier("classifierRestClient") RestClient restClient,
                                  ClassifierProperties properties) {
        this.restClient = restClient;
        this.url = properties.getUrl();
        this.modelName = properties.getModelName();
    }

    @Override
    public StancePrediction predict(String text) {
        JsonNode body;
        try {
            body = restClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(new InferenceRequest(text))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new RemoteServiceException("Classifier request failed: " + e.getMessage(), e);
        }
        return toPrediction(body);
    }

    @Override
    public String modelName() {
        return modelName;
    }

    StancePrediction toPrediction(JsonNode body) {
        JsonNode scores = body;
        if (scores != null && scores.isArray() && scores.size() > 0 && scores.get(0).isArray()) {
            scores = scores.get(0);
        }
        if (scores == null || !scores.isArray() || scores.isEmpty()) {
            throw new RemoteServiceException("Classifier returned no scores.", null);
        }

        Map<Stance, Double> probabilities = new EnumMap<>(Stance.class);
        for (JsonNode score : scores) {
            String label = score.path("label").asText("");
            if (!score.hasNonNull("score")) {
                throw new RemoteServiceException("Classifier score for '" + label + "' is missing.", null);
            }
            probabilities.put(toStance(label), score.get("score").asDouble());
        }
        return StancePrediction.fromProbabilities(probabilities);
    }

    private Stance toStance(String label) {
        Stance indexed = INDEXED_LABELS.get(label.toLowerCase(Locale.ROOT));
        if (indexed != null) {
            return indexed;
        }
        try {
            return Stance.fromLabel(label);
        } catch (IllegalArgumentException e) {
            throw new RemoteServiceException("Classifier returned unknown label '" + label + "'.", e);
        }
    }

    public record InferenceRequest(String inputs) {
    }
}
