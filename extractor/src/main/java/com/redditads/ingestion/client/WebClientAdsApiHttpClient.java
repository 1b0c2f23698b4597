package com.redditads.ingestion.client;

import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Map;

/**
 * Ads API transport using WebClient. URLs are passed as {@link URI} so query strings are sent as built.
 */
public class WebClientAdsApiHttpClient implements AdsApiHttpClient {

    private final WebClient webClient;

    public WebClientAdsApiHttpClient(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public Mono<ApiResponse> get(String url, Map<String, String> headers) {
        return webClient.get()
                .uri(URI.create(url))
                .headers(h -> headers.forEach(h::set))
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new ApiResponse(response.statusCode().value(), body)))
                .onErrorMap(WebClientRequestException.class,
                        e -> new AdsApiException("GET " + stripQuery(url) + " failed: " + e.getMessage(), e));
    }

    @Override
    public Mono<ApiResponse> postForm(String url, String username, String password,
                                      Map<String, String> headers, Map<String, String> form) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        form.forEach(body::add);
        return webClient.post()
                .uri(URI.create(url))
                .headers(h -> {
                    headers.forEach(h::set);
                    h.setBasicAuth(username, password);
                })
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(body))
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(text -> new ApiResponse(response.statusCode().value(), text)))
                .onErrorMap(WebClientRequestException.class,
                        e -> new AdsApiException("POST " + url + " failed: " + e.getMessage(), e));
    }

    private static String stripQuery(String url) {
        int q = url.indexOf('?');
        return q < 0 ? url : url.substring(0, q);
    }
}
