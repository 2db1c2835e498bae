package com.stockalerts.condition;

import com.stockalerts.domain.model.AlertKind;
import com.stockalerts.domain.model.WindowStats;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs for one condition check. Gap kinds read {@code gapBaseline} and
 * {@code sessionOpenWindow}; window kinds read {@code window}.
 */
@Value
@Builder
public class ConditionContext {

    AlertKind kind;
    BigDecimal thresholdPercent;
    BigDecimal currentPrice;
    BigDecimal gapBaseline;
    WindowStats window;
    boolean sessionOpenWindow;
}
