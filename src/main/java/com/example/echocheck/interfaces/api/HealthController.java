package com.example.echocheck.interfaces.api;

import com.example.echocheck.application.port.StanceClassifier;
import com.example.echocheck.interfaces.api.dto.HealthResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint reporting which classifier model the service is wired to.
 */
@RestController
public class HealthController {

    private final StanceClassifier stanceClassifier;

    public HealthController(StanceClassifier stanceClassifier) {
        this.stanceClassifier = stanceClassifier;
    }

    @GetMapping("/api/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", stanceClassifier.modelName());
    }
}
