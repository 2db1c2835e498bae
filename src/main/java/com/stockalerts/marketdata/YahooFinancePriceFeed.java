package com.stockalerts.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.stockalerts.domain.model.PriceQuote;
import com.stockalerts.exception.PriceUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link PriceFeed} over the Yahoo Finance chart API.
 *
 * <p>Requests {@code /v8/finance/chart/{ticker}?interval=1d&range=5d} and reads:
 * <ul>
 *   <li>price: {@code meta.regularMarketPrice}, else the last non-null daily close</li>
 *   <li>previous close: the second-to-last non-null daily close, else
 *       {@code meta.previousClose}, else {@code meta.chartPreviousClose}</li>
 *   <li>quote time: {@code meta.regularMarketTime}, else the last bar timestamp</li>
 * </ul>
 *
 * <p>Calls are rate limited and wrapped in a circuit breaker ({@code priceFeed} instances in
 * application.yml). When the breaker is open the resilience4j exception propagates; callers
 * treat any runtime exception from {@link #fetch} as a feed failure.
 */
@Component
public class YahooFinancePriceFeed implements PriceFeed {

    private static final Logger log = LoggerFactory.getLogger(YahooFinancePriceFeed.class);

    static final String CHART_PATH = "/v8/finance/chart/{ticker}?interval=1d&range=5d";

    private final RestTemplate restTemplate;
    private final MarketDataConfig marketDataConfig;
    private final SymbolNormalizer symbolNormalizer;

    public YahooFinancePriceFeed(
            @Qualifier("marketDataRestTemplate") RestTemplate restTemplate,
            MarketDataConfig marketDataConfig,
            SymbolNormalizer symbolNormalizer) {
        this.restTemplate = restTemplate;
        this.marketDataConfig = marketDataConfig;
        this.symbolNormalizer = symbolNormalizer;
    }

    @Override
    @RateLimiter(name = "priceFeed")
    @CircuitBreaker(name = "priceFeed")
    public PriceQuote fetch(String symbol) {
        String ticker = symbolNormalizer.toTicker(symbol);
        log.debug("Fetching {} as {} from Yahoo Finance", symbol, ticker);

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, marketDataConfig.getUserAgent());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        JsonNode body;
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    marketDataConfig.getBaseUrl() + CHART_PATH,
                    HttpMethod.GET,
                    new HttpEntity<>(headers),
                    JsonNode.class,
                    ticker);
            body = response.getBody();
        } catch (RestClientException e) {
            throw new PriceUnavailableException(symbol, "Yahoo Finance request failed for " + ticker, e);
        }

        return parse(symbol, ticker, body);
    }

    PriceQuote parse(String symbol, String ticker, JsonNode body) {
        if (body == null) {
            throw new PriceUnavailableException(symbol, "Empty response for " + ticker);
        }
        JsonNode chart = body.path("chart");
        JsonNode results = chart.path("result");
        if (!results.isArray() || results.isEmpty()) {
            String error = chart.path("error").path("description").asText("no result");
            throw new PriceUnavailableException(symbol, "No chart data for " + ticker + ": " + error);
        }

        JsonNode result = results.get(0);
        JsonNode meta = result.path("meta");
        List<BigDecimal> closes = nonNullCloses(result);

        BigDecimal price = decimal(meta.path("regularMarketPrice"));
        if (price == null && !closes.isEmpty()) {
            price = closes.get(closes.size() - 1);
        }
        if (price == null || price.signum() <= 0) {
            throw new PriceUnavailableException(symbol, "No valid price in response for " + ticker);
        }

        BigDecimal previousClose = closes.size() >= 2 ? closes.get(closes.size() - 2) : null;
        if (previousClose == null) {
            previousClose = decimal(meta.path("previousClose"));
        }
        if (previousClose == null) {
            previousClose = decimal(meta.path("chartPreviousClose"));
        }

        return PriceQuote.builder()
                .symbol(symbol)
                .tickerSymbol(ticker)
                .price(price)
                .previousClose(previousClose)
                .asOf(quoteTime(result, meta))
                .build();
    }

    private static List<BigDecimal> nonNullCloses(JsonNode result) {
        List<BigDecimal> closes = new ArrayList<>();
        JsonNode closeArray = result.path("indicators").path("quote").path(0).path("close");
        if (closeArray.isArray()) {
            for (JsonNode close : closeArray) {
                BigDecimal value = decimal(close);
                if (value != null) {
                    closes.add(value);
                }
            }
        }
        return closes;
    }

    private static Instant quoteTime(JsonNode result, JsonNode meta) {
        JsonNode marketTime = meta.path("regularMarketTime");
        if (marketTime.isNumber()) {
            return Instant.ofEpochSecond(marketTime.asLong());
        }
        JsonNode timestamps = result.path("timestamp");
        if (timestamps.isArray() && !timestamps.isEmpty()) {
            return Instant.ofEpochSecond(timestamps.get(timestamps.size() - 1).asLong());
        }
        return null;
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        // decimalValue() on a double node carries the binary expansion; go through the text form
        return new BigDecimal(node.asText());
    }
}
