package com.redditads.ingestion.client;

/**
 * Thrown when an Ads API call fails (transport error or unexpected HTTP status).
 */
public class AdsApiException extends RuntimeException {

    public AdsApiException(String message) {
        super(message);
    }

    public AdsApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
