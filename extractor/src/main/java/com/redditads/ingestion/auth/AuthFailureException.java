package com.redditads.ingestion.auth;

/**
 * Token refresh rejected or answered with an unusable payload. Ends the run.
 */
public class AuthFailureException extends RuntimeException {

    public AuthFailureException(String message) {
        super(message);
    }

    public AuthFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
