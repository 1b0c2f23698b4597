package com.redditads.ingestion.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redditads.common.RateGovernor;
import com.redditads.common.RetryPolicy;
import com.redditads.config.ExtractorProperties;
import com.redditads.domain.CredentialStore;
import com.redditads.ingestion.auth.TokenManager;
import com.redditads.ingestion.client.AdsApiException;
import com.redditads.ingestion.client.AdsApiHttpClient;
import com.redditads.ingestion.client.ApiResponse;
import com.redditads.ingestion.client.RateLimitedException;
import com.redditads.ingestion.client.RequestFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Authenticated GET against the account-scoped Ads API. Each attempt waits for the shared
 * {@link RateGovernor}; HTTP 429 is retried per {@link RetryPolicy}, every other failure propagates.
 */
@Component
@Slf4j
public class RateLimitedFetcher {

    public static final String AUTHORIZATION = "Authorization";

    private final AdsApiHttpClient httpClient;
    private final TokenManager tokenManager;
    private final RateGovernor rateGovernor;
    private final RetryPolicy retryPolicy;
    private final ExtractorProperties properties;
    private final ObjectMapper objectMapper;

    public RateLimitedFetcher(AdsApiHttpClient httpClient, TokenManager tokenManager, RateGovernor rateGovernor,
                              RetryPolicy retryPolicy, ExtractorProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.tokenManager = tokenManager;
        this.rateGovernor = rateGovernor;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Fetch the {@code data} rows of an endpoint.
     *
     * @param credentials  run credentials; refreshed in place when expired
     * @param endpointPath path below the account root, e.g. {@code /reports}; empty for the account itself
     * @param queryParams  flat query parameters, may be empty
     * @param headerState  caller-owned headers reused across calls of one stream; receives the Authorization header
     * @return rows of {@code data}: a single object is wrapped, a missing field yields an empty list
     * @throws RateLimitedException   when still rate limited after the last attempt
     * @throws RequestFailedException on any other non-200 status
     */
    public List<JsonNode> fetch(CredentialStore credentials, String endpointPath,
                                Map<String, String> queryParams, Map<String, String> headerState) {
        String url = buildUrl(credentials.getAccountId(), endpointPath, queryParams);
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                return fetchOnce(credentials, url, headerState);
            } catch (RateLimitedException e) {
                if (!retryPolicy.canRetry(attempts)) {
                    log.error("Giving up on {} after {} rate-limited attempts", stripQuery(url), attempts);
                    throw e;
                }
                long delayMs = retryPolicy.delayAfterMs(attempts);
                log.warn("Rate limited on {} (attempt {}/{}), backing off {} ms",
                        stripQuery(url), attempts, retryPolicy.getMaxAttempts(), delayMs);
                sleep(delayMs);
            }
        }
    }

    private List<JsonNode> fetchOnce(CredentialStore credentials, String url, Map<String, String> headerState) {
        rateGovernor.acquire();
        if (tokenManager.ensureFreshToken(credentials) || !headerState.containsKey(AUTHORIZATION)) {
            headerState.put(AUTHORIZATION, credentials.authorizationHeaderValue());
        }
        log.debug("GET {}", url);
        ApiResponse response = httpClient.get(url, Map.copyOf(headerState)).block();
        if (response == null) {
            throw new AdsApiException("No response from " + stripQuery(url));
        }
        if (response.status() == 429) {
            throw new RateLimitedException(stripQuery(url), response.body());
        }
        if (response.status() != 200) {
            throw new RequestFailedException(stripQuery(url), response.status(), response.body());
        }
        return parseData(url, response.body());
    }

    List<JsonNode> parseData(String url, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RequestFailedException(stripQuery(url), 200, body, e);
        }
        JsonNode data = root == null ? null : root.get("data");
        if (data == null || data.isNull() || data.isMissingNode()) {
            return List.of();
        }
        if (data.isObject()) {
            return List.of(data);
        }
        List<JsonNode> rows = new ArrayList<>(data.size());
        data.forEach(rows::add);
        return rows;
    }

    /**
     * Account-scoped URL with the query appended verbatim ({@code k=v} joined by {@code &}).
     * Values are not percent-encoded.
     */
    String buildUrl(String accountId, String endpointPath, Map<String, String> queryParams) {
        String url = properties.getApiHost()
                + properties.getAccountPath().replace("{account_id}", accountId)
                + endpointPath;
        if (queryParams != null && !queryParams.isEmpty()) {
            url += "?" + queryParams.entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining("&"));
        }
        return url;
    }

    private static void sleep(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdsApiException("Interrupted during rate-limit backoff", e);
        }
    }

    private static String stripQuery(String url) {
        int q = url.indexOf('?');
        return q < 0 ? url : url.substring(0, q);
    }
}
