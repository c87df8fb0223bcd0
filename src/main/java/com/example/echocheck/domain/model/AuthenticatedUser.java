package com.example.echocheck.domain.model;

/**
 * Identity confirmed by the token verifier for an authenticated request.
 */
public record AuthenticatedUser(
        String id,
        String email
) {
}
