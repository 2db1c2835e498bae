package com.stockalerts.marketdata;

import com.stockalerts.domain.model.PriceQuote;
import com.stockalerts.exception.PriceUnavailableException;

/**
 * External source of current prices. Implementations must bound every call with a timeout.
 */
public interface PriceFeed {

    /**
     * @throws PriceUnavailableException if no usable price could be obtained
     */
    PriceQuote fetch(String symbol);
}
