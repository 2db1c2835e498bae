package com.stockalerts.exception;

import java.util.Map;

/**
 * No price could be produced for a symbol: the external feed failed and no secondary
 * cache entry exists. Alerts on the symbol are neither fired nor cleared for the cycle.
 */
public class PriceUnavailableException extends BaseException {

    public PriceUnavailableException(String symbol, String message) {
        super(ErrorCode.PRICE_UNAVAILABLE, message, Map.of("symbol", symbol));
    }

    public PriceUnavailableException(String symbol, String message, Throwable cause) {
        super(ErrorCode.PRICE_UNAVAILABLE, message + " [symbol=" + symbol + "]", cause);
    }
}
