package com.redditads.domain;

import lombok.Getter;

import java.time.Instant;

/**
 * OAuth2 credentials for one run. The token fields are replaced in place on every refresh,
 * so the fetcher always reads the latest access token through the same instance.
 */
@Getter
public class CredentialStore {

    private final String accountId;
    private final String clientId;
    private final String clientSecret;
    private final String userAgent;
    private String refreshToken;
    private String accessToken;
    /** Null until the first refresh unless supplied by config. */
    private Instant expiresAt;

    public CredentialStore(String accountId, String clientId, String clientSecret, String userAgent,
                           String refreshToken, String accessToken, Instant expiresAt) {
        this.accountId = accountId;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.userAgent = userAgent;
        this.refreshToken = refreshToken;
        this.accessToken = accessToken;
        this.expiresAt = expiresAt;
    }

    /**
     * True when no expiry is known or the expiry lies before {@code now}.
     */
    public boolean isAccessTokenExpired(Instant now) {
        return expiresAt == null || expiresAt.isBefore(now);
    }

    public void applyRefresh(String accessToken, String refreshToken, Instant expiresAt) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresAt = expiresAt;
    }

    public String authorizationHeaderValue() {
        return "bearer " + accessToken;
    }

    @Override
    public String toString() {
        return "CredentialStore{accountId='" + accountId + "', clientId='" + clientId
                + "', expiresAt=" + expiresAt + '}';
    }
}
