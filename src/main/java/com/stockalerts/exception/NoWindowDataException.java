package com.stockalerts.exception;

import java.time.Duration;
import java.util.Map;

/**
 * A rolling window holds no observation inside the requested range. Callers treat this
 * as "condition not evaluable yet", never as an error to report to the alert owner.
 */
public class NoWindowDataException extends BaseException {

    public NoWindowDataException(String symbol, Duration duration) {
        super(
                ErrorCode.NO_WINDOW_DATA,
                String.format("No observations for %s in the last %d minutes", symbol, duration.toMinutes()),
                Map.of("symbol", symbol, "windowMinutes", duration.toMinutes()));
    }
}
