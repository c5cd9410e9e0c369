package com.subscription.infrastructure.identity;

import com.fasterxml.jackson.databind.JsonNode;
import com.subscription.domain.exception.IdentityServiceException;
import com.subscription.domain.exception.IdentityServiceUnavailableException;
import com.subscription.domain.exception.UnauthorizedException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.UUID;

/**
 * Verifies bearer tokens against the identity service ({@code GET /users/me}).
 *
 * Connection failures are retried (see {@code resilience4j.retry.instances.identityService})
 * before surfacing as {@link IdentityServiceUnavailableException}.
 */
@Slf4j
@Component
public class IdentityServiceClient {

    private static final String CURRENT_USER_PATH = "/users/me";

    private final RestClient restClient;

    public IdentityServiceClient(@Qualifier("identityRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Retry(name = "identityService")
    public UUID resolveUserId(String bearerToken) {
        JsonNode user;
        try {
            log.debug("Calling identity service at {}", CURRENT_USER_PATH);
            user = restClient.get()
                    .uri(CURRENT_USER_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
                log.debug("Identity service returned 401, invalid token");
                throw new UnauthorizedException("Invalid token");
            }
            log.error("Identity service returned error {}: {}", e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new IdentityServiceException("An error occurred during authentication.", e);
        } catch (ResourceAccessException e) {
            log.error("Could not connect to identity service: {}", e.getMessage());
            throw new IdentityServiceUnavailableException("Authentication service is unavailable.", e);
        } catch (RestClientException e) {
            log.error("Unexpected error during token validation: {}", e.getMessage(), e);
            throw new IdentityServiceException("An unexpected error occurred during authentication.", e);
        }

        JsonNode id = user == null ? null : user.get("id");
        if (id == null || !id.isTextual()) {
            log.error("Identity service response missing 'id' field");
            throw new IdentityServiceException("Invalid response from authentication service");
        }
        try {
            UUID userId = UUID.fromString(id.asText());
            log.debug("Token validated for user {}", userId);
            return userId;
        } catch (IllegalArgumentException e) {
            throw new IdentityServiceException("Invalid response from authentication service", e);
        }
    }
}
