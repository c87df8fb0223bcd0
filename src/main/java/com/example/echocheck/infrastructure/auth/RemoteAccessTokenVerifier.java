package com.example.echocheck.infrastructure.auth;

import com.example.echocheck.application.exception.UnauthorizedException;
import com.example.echocheck.application.port.AccessTokenVerifier;
import com.example.echocheck.config.AuthProperties;
import com.example.echocheck.domain.model.AuthenticatedUser;
import com.example.echocheck.infrastructure.exception.RemoteServiceException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link AccessTokenVerifier} that asks the identity service who owns a bearer token.
 * A 401 or 403 answer means the token is not acceptable; anything else unexpected is an infrastructure failure.
 */
@Service
public class RemoteAccessTokenVerifier implements AccessTokenVerifier {

    private final RestClient restClient;
    private final String verifyUrl;

    public RemoteAccessTokenVerifier(@Qualifier("authRestClient") RestClient restClient, AuthProperties properties) {
        this.restClient = restClient;
        this.verifyUrl = properties.getVerifyUrl();
    }

    @Override
    public AuthenticatedUser verify(String accessToken) {
        if (!StringUtils.hasText(accessToken)) {
            throw new UnauthorizedException("Not authenticated");
        }
        UserPayload user;
        try {
            user = restClient.get()
                    .uri(verifyUrl)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(UserPayload.class);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.UNAUTHORIZED)
                    || e.getStatusCode().isSameCodeAs(HttpStatus.FORBIDDEN)) {
                throw new UnauthorizedException("Invalid or expired access token");
            }
            throw new RemoteServiceException("Token verification failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new RemoteServiceException("Token verification failed: " + e.getMessage(), e);
        }

        if (user == null || !StringUtils.hasText(user.id())) {
            throw new UnauthorizedException("User not found");
        }
        return new AuthenticatedUser(user.id(), user.email());
    }

    public record UserPayload(String id, String email) {
    }
}
