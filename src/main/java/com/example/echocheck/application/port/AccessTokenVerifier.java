package com.example.echocheck.application.port;

import com.example.echocheck.application.exception.UnauthorizedException;
import com.example.echocheck.domain.model.AuthenticatedUser;

/**
 * Opaque token service guarding the file upload use case.
 */
public interface AccessTokenVerifier {

    /**
     * Resolves the user behind a bearer token.
     *
     * @param accessToken raw token without the {@code Bearer } prefix
     * @return verified identity
     * @throws UnauthorizedException when the token is missing, invalid or expired
     */
    AuthenticatedUser verify(String accessToken);
}
