package com.redditads.ingestion.client;

/**
 * Non-200, non-429 response (or unreadable 200 body) from the Ads API. Never retried.
 */
public class RequestFailedException extends AdsApiException {

    private final int status;
    private final String responseBody;

    public RequestFailedException(String url, int status, String responseBody) {
        super("Request to " + url + " failed with HTTP " + status + ": " + responseBody);
        this.status = status;
        this.responseBody = responseBody;
    }

    public RequestFailedException(String url, int status, String responseBody, Throwable cause) {
        super("Request to " + url + " failed with HTTP " + status + ": " + responseBody, cause);
        this.status = status;
        this.responseBody = responseBody;
    }

    public int getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
