package com.redditads.ingestion.client;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Raw HTTP transport for the Ads API and its OAuth endpoint. Implementations never fail on
 * non-2xx statuses; callers classify the returned {@link ApiResponse}.
 */
public interface AdsApiHttpClient {

    Mono<ApiResponse> get(String url, Map<String, String> headers);

    /**
     * POST an {@code application/x-www-form-urlencoded} body with HTTP basic auth.
     */
    Mono<ApiResponse> postForm(String url, String username, String password,
                               Map<String, String> headers, Map<String, String> form);
}
