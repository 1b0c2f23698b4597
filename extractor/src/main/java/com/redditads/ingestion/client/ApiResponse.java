package com.redditads.ingestion.client;

/**
 * Raw HTTP outcome: status code and body text (empty when the response had no body).
 */
public record ApiResponse(int status, String body) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
