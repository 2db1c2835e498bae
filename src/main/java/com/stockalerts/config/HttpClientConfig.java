package com.stockalerts.config;

import com.stockalerts.marketdata.MarketDataConfig;
import java.time.Duration;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Outbound HTTP clients. Each external service gets its own {@link RestTemplate} so timeouts
 * can be tuned independently.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate marketDataRestTemplate(RestTemplateBuilder builder, MarketDataConfig marketDataConfig) {
        return builder.connectTimeout(Duration.ofMillis(marketDataConfig.getConnectTimeoutMillis()))
                .readTimeout(Duration.ofMillis(marketDataConfig.getReadTimeoutMillis()))
                .build();
    }

    @Bean
    public RestTemplate telegramRestTemplate(RestTemplateBuilder builder) {
        return builder.connectTimeout(Duration.ofSeconds(5))
                .readTimeout(Duration.ofSeconds(10))
                .build();
    }
}
