package com.stockalerts.domain.model;

import com.stockalerts.domain.enums.PriceTier;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One price reading for a symbol, as produced by the price cache.
 *
 * <p>{@code observedAt} is the instant the engine fetched the price, which keeps window
 * timestamps monotonic even when the vendor's quote time lags. {@code stale} marks a
 * secondary-cache entry returned past its TTL because the feed failed.
 */
@Value
@Builder(toBuilder = true)
public class PriceObservation {

    String symbol;
    BigDecimal price;
    Instant observedAt;

    /** Previous session close as reported by the feed; null when unknown. */
    BigDecimal previousClose;

    @Builder.Default
    PriceTier tier = PriceTier.FEED;

    boolean stale;

    public Duration ageAt(Instant now) {
        return Duration.between(observedAt, now);
    }
}
