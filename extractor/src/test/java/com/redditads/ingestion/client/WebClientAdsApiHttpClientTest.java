package com.redditads.ingestion.client;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientAdsApiHttpClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private WebClientAdsApiHttpClient clientReturning(HttpStatus status, String body) {
        return new WebClientAdsApiHttpClient(WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        }));
    }

    @Test
    void getSendsUrlAsBuiltWithHeaders() {
        WebClientAdsApiHttpClient client = clientReturning(HttpStatus.OK, "{\"data\":[]}");
        String url = "https://ads-api.reddit.com/api/v2.0/accounts/t2_acct/reports?starts_at=2024-01-01T00:00:00Z";

        ApiResponse response = client.get(url, Map.of("Authorization", "bearer tok")).block();

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.body()).isEqualTo("{\"data\":[]}");
        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.GET);
        assertThat(lastRequest.get().url()).isEqualTo(URI.create(url));
        assertThat(lastRequest.get().headers().getFirst("Authorization")).isEqualTo("bearer tok");
    }

    @Test
    void nonSuccessStatusIsReturnedNotThrown() {
        WebClientAdsApiHttpClient client = clientReturning(HttpStatus.TOO_MANY_REQUESTS, "slow down");

        ApiResponse response = client.get("https://ads-api.reddit.com/x", Map.of()).block();

        assertThat(response.status()).isEqualTo(429);
        assertThat(response.isSuccess()).isFalse();
        assertThat(response.body()).isEqualTo("slow down");
    }

    @Test
    void postFormUsesBasicAuth() {
        WebClientAdsApiHttpClient client = clientReturning(HttpStatus.OK, "{}");

        client.postForm("https://www.reddit.com/api/v1/access_token", "client", "secret",
                Map.of("User-Agent", "tap/1.0"), Map.of("grant_type", "refresh_token")).block();

        ClientRequest request = lastRequest.get();
        String expected = "Basic " + Base64.getEncoder()
                .encodeToString("client:secret".getBytes(StandardCharsets.ISO_8859_1));
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo(expected);
        assertThat(request.headers().getFirst("User-Agent")).isEqualTo("tap/1.0");
        assertThat(request.headers().getContentType()).isEqualTo(MediaType.APPLICATION_FORM_URLENCODED);
    }

    @Test
    void transportFailureBecomesAdsApiException() {
        WebClientAdsApiHttpClient client = new WebClientAdsApiHttpClient(WebClient.builder().exchangeFunction(
                request -> Mono.error(new WebClientRequestException(new ConnectException("refused"),
                        request.method(), request.url(), request.headers()))));

        assertThatThrownBy(() -> client.get("https://ads-api.reddit.com/x?secret=1", Map.of()).block())
                .isInstanceOf(AdsApiException.class)
                .hasMessageStartingWith("GET https://ads-api.reddit.com/x failed")
                .hasCauseInstanceOf(WebClientRequestException.class);
    }
}
