package com.stockalerts.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Raw quote returned by a price feed for one symbol.
 */
@Value
@Builder
public class PriceQuote {

    String symbol;

    /** Vendor ticker the quote was requested with (e.g. "TCS.NS"). */
    String tickerSymbol;

    BigDecimal price;
    BigDecimal previousClose;

    /** Vendor's own quote timestamp. */
    Instant asOf;
}
