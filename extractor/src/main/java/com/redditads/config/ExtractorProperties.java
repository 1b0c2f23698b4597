package com.redditads.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime settings for the Ads API client. Documented in application.yml under redditads.
 */
@ConfigurationProperties(prefix = "redditads")
@NoArgsConstructor
@Getter
@Setter
public class ExtractorProperties {

    /** Ads API host. */
    private String apiHost = "https://ads-api.reddit.com";

    /** Account root path; {account_id} is replaced with the configured account. */
    private String accountPath = "/api/v2.0/accounts/{account_id}";

    /** OAuth2 token endpoint used for the refresh-token grant. */
    private String tokenUrl = "https://www.reddit.com/api/v1/access_token";

    /** Minimum spacing between two Ads API requests, shared by all streams. */
    private long minRequestIntervalMs = 1_000;

    /** Trailing days treated as unsettled when the tap config does not set conversion_window. */
    private int defaultConversionWindowDays = 14;

    /** Connect timeout in seconds for the HTTP client. */
    private int connectTimeoutSeconds = 10;

    /** Response timeout in seconds for the HTTP client. */
    private int responseTimeoutSeconds = 60;

    private Retry retry = new Retry();

    /**
     * Backoff applied to HTTP 429 responses.
     */
    @Getter
    @Setter
    public static class Retry {
        /** Delay after the first rate-limited attempt; doubles each attempt. */
        private long baseDelayMs = 2_000L;
        /** Jitter factor 0..1 (0.2 = ±20%). */
        private double jitterFactor = 0.2;
        /** Total attempts including the first call. */
        private int maxAttempts = 5;
    }
}
