package com.stockalerts.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.stockalerts.domain.model.PriceQuote;
import com.stockalerts.exception.PriceUnavailableException;
import com.stockalerts.marketdata.MarketDataConfig;
import com.stockalerts.marketdata.SymbolNormalizer;
import com.stockalerts.marketdata.YahooFinancePriceFeed;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

/**
 * Tests for YahooFinancePriceFeed against canned chart responses.
 */
class YahooFinancePriceFeedTest {

    private static final String TCS_URL = "https://yahoo.test/v8/finance/chart/TCS.NS?interval=1d&range=5d";

    private MockRestServiceServer server;
    private YahooFinancePriceFeed priceFeed;

    @BeforeEach
    void setUp() {
        MarketDataConfig config = new MarketDataConfig();
        config.setBaseUrl("https://yahoo.test");
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        priceFeed = new YahooFinancePriceFeed(restTemplate, config, new SymbolNormalizer(config));
    }

    @Test
    @DisplayName("reads price, previous close and quote time from the chart response")
    void parsesChart() {
        server.expect(requestTo(TCS_URL))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.USER_AGENT, startsWith("Mozilla/5.0")))
                .andRespond(withSuccess(new ClassPathResource("fixtures/yahoo-chart-tcs.json"), MediaType.APPLICATION_JSON));

        PriceQuote quote = priceFeed.fetch("tcs");

        assertThat(quote.getSymbol()).isEqualTo("tcs");
        assertThat(quote.getTickerSymbol()).isEqualTo("TCS.NS");
        assertThat(quote.getPrice()).isEqualByComparingTo("3456.8");
        // second-to-last non-null close, skipping the holiday bar
        assertThat(quote.getPreviousClose()).isEqualByComparingTo("3420.0");
        assertThat(quote.getAsOf()).isEqualTo(Instant.ofEpochSecond(1792387800L));
        server.verify();
    }

    @Test
    @DisplayName("falls back to the last close and meta previous close")
    void fallbacks() {
        String body = "{\"chart\":{\"result\":[{\"meta\":{\"previousClose\":3418.0},"
                + "\"timestamp\":[1792387800],"
                + "\"indicators\":{\"quote\":[{\"close\":[3450.15]}]}}],\"error\":null}}";
        server.expect(requestTo(TCS_URL)).andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        PriceQuote quote = priceFeed.fetch("TCS");

        assertThat(quote.getPrice()).isEqualByComparingTo("3450.15");
        assertThat(quote.getPreviousClose()).isEqualByComparingTo("3418.0");
        assertThat(quote.getAsOf()).isEqualTo(Instant.ofEpochSecond(1792387800L));
    }

    @Test
    @DisplayName("an unknown symbol is reported as unavailable")
    void unknownSymbol() {
        String body = "{\"chart\":{\"result\":null,\"error\":{\"code\":\"Not Found\","
                + "\"description\":\"No data found, symbol may be delisted\"}}}";
        server.expect(requestTo("https://yahoo.test/v8/finance/chart/NOPE.NS?interval=1d&range=5d"))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> priceFeed.fetch("NOPE"))
                .isInstanceOf(PriceUnavailableException.class)
                .hasMessageContaining("delisted");
    }

    @Test
    @DisplayName("HTTP errors are translated to PriceUnavailableException")
    void serverError() {
        server.expect(requestTo(TCS_URL)).andRespond(withServerError());

        assertThatThrownBy(() -> priceFeed.fetch("TCS")).isInstanceOf(PriceUnavailableException.class);
    }

    @Test
    @DisplayName("a response without any price is rejected")
    void noPrice() {
        String body = "{\"chart\":{\"result\":[{\"meta\":{},\"indicators\":{\"quote\":[{\"close\":[null]}]}}]}}";
        server.expect(requestTo(TCS_URL)).andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> priceFeed.fetch("TCS"))
                .isInstanceOf(PriceUnavailableException.class)
                .hasMessageContaining("No valid price");
    }
}
