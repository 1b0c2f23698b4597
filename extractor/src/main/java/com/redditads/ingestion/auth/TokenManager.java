package com.redditads.ingestion.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redditads.config.ExtractorProperties;
import com.redditads.domain.CredentialStore;
import com.redditads.ingestion.client.AdsApiHttpClient;
import com.redditads.ingestion.client.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lazily refreshes the OAuth2 access token with the refresh-token grant.
 */
@Component
@Slf4j
public class TokenManager {

    private final AdsApiHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ExtractorProperties properties;
    private final Clock clock;

    public TokenManager(AdsApiHttpClient httpClient, ObjectMapper objectMapper,
                        ExtractorProperties properties, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Refresh the token when its expiry is unknown or already passed.
     *
     * @return true if a refresh request was made and the credentials were updated
     * @throws AuthFailureException when the token endpoint rejects the grant or answers with an unusable payload
     */
    public boolean ensureFreshToken(CredentialStore credentials) {
        Instant now = clock.instant();
        if (!credentials.isAccessTokenExpired(now)) {
            return false;
        }
        JsonNode payload = requestToken(credentials);
        String accessToken = requiredText(payload, "access_token");
        // Keep the current refresh token when the grant does not rotate it.
        String refreshToken = payload.path("refresh_token").isTextual()
                ? payload.path("refresh_token").asText()
                : credentials.getRefreshToken();
        JsonNode expiresIn = payload.path("expires_in");
        if (!expiresIn.canConvertToLong()) {
            throw new AuthFailureException("Token response has no numeric expires_in");
        }
        Instant expiresAt = clock.instant().plusSeconds(expiresIn.asLong());
        credentials.applyRefresh(accessToken, refreshToken, expiresAt);
        log.info("Refreshed access token for account {}, expires at {}", credentials.getAccountId(), expiresAt);
        return true;
    }

    private JsonNode requestToken(CredentialStore credentials) {
        Map<String, String> headers = Map.of("User-Agent", credentials.getUserAgent());
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", credentials.getRefreshToken());
        ApiResponse response = httpClient.postForm(properties.getTokenUrl(),
                credentials.getClientId(), credentials.getClientSecret(), headers, form).block();
        if (response == null) {
            throw new AuthFailureException("Token endpoint returned no response");
        }
        if (!response.isSuccess()) {
            throw new AuthFailureException("Token refresh failed with HTTP " + response.status() + ": " + response.body());
        }
        try {
            JsonNode root = objectMapper.readTree(response.body());
            if (root == null || !root.isObject()) {
                throw new AuthFailureException("Token response is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new AuthFailureException("Token response is not valid JSON", e);
        }
    }

    private static String requiredText(JsonNode payload, String field) {
        JsonNode node = payload.path(field);
        if (!node.isTextual() || node.asText().isBlank()) {
            throw new AuthFailureException("Token response has no " + field);
        }
        return node.asText();
    }
}
