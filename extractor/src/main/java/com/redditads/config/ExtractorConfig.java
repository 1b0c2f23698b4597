package com.redditads.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.redditads.common.RateGovernor;
import com.redditads.common.RetryPolicy;
import com.redditads.ingestion.client.AdsApiHttpClient;
import com.redditads.ingestion.client.WebClientAdsApiHttpClient;
import com.redditads.output.MessageWriter;
import com.redditads.output.SingerMessageWriter;
import io.netty.channel.ChannelOption;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.io.PrintStream;
import java.time.Clock;
import java.time.Duration;

/**
 * Shared beans for one extractor process: the single rate governor, retry policy, HTTP client and
 * the stdout message sink.
 */
@Configuration
@EnableConfigurationProperties(ExtractorProperties.class)
public class ExtractorConfig {

    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** One instance per process: every stream draws from the same request budget. */
    @Bean
    public RateGovernor adsApiRateGovernor(ExtractorProperties properties) {
        return new RateGovernor(Duration.ofMillis(Math.max(0L, properties.getMinRequestIntervalMs())));
    }

    @Bean
    public RetryPolicy rateLimitRetryPolicy(ExtractorProperties properties) {
        ExtractorProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
    }

    @Bean
    public AdsApiHttpClient adsApiHttpClient(WebClient.Builder webClientBuilder, ExtractorProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.getConnectTimeoutSeconds() * 1000)
                .responseTimeout(Duration.ofSeconds(properties.getResponseTimeoutSeconds()));
        WebClient.Builder builder = webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES));
        return new WebClientAdsApiHttpClient(builder);
    }

    @Bean
    public PrintStream messageOutput() {
        return System.out;
    }

    @Bean
    public MessageWriter messageWriter(ObjectMapper objectMapper, PrintStream messageOutput) {
        return new SingerMessageWriter(objectMapper, messageOutput);
    }
}
