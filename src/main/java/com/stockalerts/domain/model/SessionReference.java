package com.stockalerts.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Per-symbol, per-trading-day baseline for gap alerts. Captured once at the first cycle
 * after the open and never changed for the rest of that session.
 */
@Value
@Builder
public class SessionReference {

    String symbol;
    LocalDate sessionDate;

    /** First price observed for the symbol in this session. */
    BigDecimal openingPrice;

    /** Previous session close reported by the feed; null when the feed did not supply it. */
    BigDecimal previousClose;

    Instant capturedAt;

    /**
     * Price gap alerts are measured against: the previous close when known, otherwise the
     * session's first observed price.
     */
    public BigDecimal getBaseline() {
        return previousClose != null ? previousClose : openingPrice;
    }
}
