package com.stockalerts.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Extremes of a rolling window at query time.
 */
@Value
@Builder
public class WindowStats {

    BigDecimal high;
    BigDecimal low;
    int count;
    Instant oldest;
    Instant newest;
}
