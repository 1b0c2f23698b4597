package com.redditads.ingestion.client;

/**
 * HTTP 429 from the Ads API. The only failure the fetcher retries.
 */
public class RateLimitedException extends AdsApiException {

    private final String responseBody;

    public RateLimitedException(String url, String responseBody) {
        super("Rate limited by " + url + ": " + responseBody);
        this.responseBody = responseBody;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
