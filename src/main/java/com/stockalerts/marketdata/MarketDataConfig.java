package com.stockalerts.marketdata;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for the external price feed.
 *
 * <pre>
 * market-data.base-url=https://query1.finance.yahoo.com
 * market-data.exchange-suffix=.NS
 * market-data.passthrough-symbols=AAPL,MSFT
 * market-data.connect-timeout-millis=3000
 * market-data.read-timeout-millis=5000
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "market-data")
public class MarketDataConfig {

    private String baseUrl = "https://query1.finance.yahoo.com";
    private String exchangeSuffix = ".NS";

    /** Bare symbols that are already valid vendor tickers and must not receive the suffix. */
    private List<String> passthroughSymbols = new ArrayList<>();

    private String userAgent =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private int connectTimeoutMillis = 3000;
    private int readTimeoutMillis = 5000;
}
