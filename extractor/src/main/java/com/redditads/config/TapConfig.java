package com.redditads.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.redditads.domain.CredentialStore;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * User supplied tap config file ({@code --config}). Keys use the snake_case names of the file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@Getter
@Setter
public class TapConfig {

    @NotBlank(message = "starts_at")
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}.*", message = "starts_at must start with YYYY-MM-DD")
    @JsonProperty("starts_at")
    private String startsAt;

    @NotBlank(message = "account_id")
    @JsonProperty("account_id")
    private String accountId;

    @NotBlank(message = "refresh_token")
    @JsonProperty("refresh_token")
    private String refreshToken;

    @NotBlank(message = "client_id")
    @JsonProperty("client_id")
    private String clientId;

    @NotBlank(message = "client_secret")
    @JsonProperty("client_secret")
    private String clientSecret;

    @NotBlank(message = "user_agent")
    @JsonProperty("user_agent")
    private String userAgent;

    @PositiveOrZero(message = "conversion_window must not be negative")
    @JsonProperty("conversion_window")
    private Integer conversionWindow;

    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("expires_at")
    private Instant expiresAt;

    public LocalDate startDate() {
        return LocalDate.parse(startsAt.substring(0, 10));
    }

    public int conversionWindowOr(int defaultDays) {
        return conversionWindow != null ? conversionWindow : defaultDays;
    }

    public CredentialStore toCredentialStore() {
        return new CredentialStore(accountId, clientId, clientSecret, userAgent,
                refreshToken, accessToken, expiresAt);
    }
}
