package com.example.echocheck.interfaces.api.dto;

/**
 * Liveness payload.
 */
public record HealthResponse(
        String status,
        String classifierModel
) {
}
