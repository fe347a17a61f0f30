package com.pivotbot.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client for the public market-data endpoints.
 */
@Configuration
public class RestTemplateConfig {

    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final String userAgent;

    public RestTemplateConfig(@Value("${marketdata.binance.connect-timeout-ms:5000}") long connectTimeoutMs,
                              @Value("${marketdata.binance.read-timeout-ms:10000}") long readTimeoutMs,
                              @Value("${marketdata.user-agent:pivot-bot-backend}") String userAgent) {
        this.connectTimeout = Duration.ofMillis(connectTimeoutMs);
        this.readTimeout = Duration.ofMillis(readTimeoutMs);
        this.userAgent = userAgent;
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        // klines requests stay well inside the cycle deadline
        return builder
            .setConnectTimeout(connectTimeout)
            .setReadTimeout(readTimeout)
            .defaultHeader("User-Agent", userAgent)
            .defaultHeader("Accept", "application/json")
            .build();
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }
}
