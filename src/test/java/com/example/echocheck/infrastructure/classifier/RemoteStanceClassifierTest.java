package com.example.echocheck.infrastructure.classifier;

import com.example.echocheck.config.ClassifierProperties;
import com.example.echocheck.domain.model.Stance;
import com.example.echocheck.domain.model.StancePrediction;
import com.example.echocheck.infrastructure.exception.RemoteServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemoteStanceClassifierTest {

    private static final String URL = "http://classifier.test/predict";

    private MockRestServiceServer server;
    private RemoteStanceClassifier classifier;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        ClassifierProperties properties = new ClassifierProperties();
        properties.setUrl(URL);
        properties.setModelName("test-model");
        classifier = new RemoteStanceClassifier(builder.build(), properties);
    }

    @Test
    void predictReadsNestedScores() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"inputs\":\"Taxes should go up.\"}"))
                .andRespond(withSuccess("""
                        [[{"label":"left","score":0.7},{"label":"center","score":0.2},{"label":"right","score":0.1}]]
                        """, MediaType.APPLICATION_JSON));

        StancePrediction prediction = classifier.predict("Taxes should go up.");

        assertThat(prediction.stance()).isEqualTo(Stance.LEFT);
        assertThat(prediction.confidence()).isCloseTo(0.7, within(1e-9));
        assertThat(prediction.probabilityOf(Stance.RIGHT)).isCloseTo(0.1, within(1e-9));
        server.verify();
    }

    @Test
    void predictReadsFlatScoresWithIndexedLabels() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("""
                        [{"label":"LABEL_0","score":0.15},{"label":"LABEL_1","score":0.25},{"label":"LABEL_2","score":0.6}]
                        """, MediaType.APPLICATION_JSON));

        StancePrediction prediction = classifier.predict("Cut regulations on small businesses.");

        assertThat(prediction.stance()).isEqualTo(Stance.RIGHT);
        assertThat(prediction.probabilityOf(Stance.CENTER)).isCloseTo(0.15, within(1e-9));
        assertThat(prediction.probabilityOf(Stance.LEFT)).isCloseTo(0.25, within(1e-9));
    }

    @Test
    void predictRejectsUnknownLabels() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("[{\"label\":\"libertarian\",\"score\":0.9}]", MediaType.APPLICATION_JSON));

        RemoteServiceException ex = assertThrows(RemoteServiceException.class, () -> classifier.predict("some text here"));

        assertThat(ex.getMessage()).contains("libertarian");
    }

    @Test
    void predictRejectsEmptyAnswers() {
        server.expect(requestTo(URL)).andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertThrows(RemoteServiceException.class, () -> classifier.predict("some text here"));
    }

    @Test
    void predictWrapsServerErrors() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        RemoteServiceException ex = assertThrows(RemoteServiceException.class, () -> classifier.predict("some text here"));

        assertThat(ex.getMessage()).startsWith("Classifier request failed");
    }

    @Test
    void modelNameComesFromProperties() {
        assertThat(classifier.modelName()).isEqualTo("test-model");
    }
}
