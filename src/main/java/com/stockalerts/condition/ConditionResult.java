package com.stockalerts.condition;

import com.stockalerts.domain.enums.EvaluationReason;
import java.math.BigDecimal;
import lombok.Value;

/**
 * Outcome of evaluating one alert condition.
 *
 * <p>{@code movePercent} is {@code (price - reference) / reference * 100} rounded half-up to
 * two places; null only when there was no usable reference.
 */
@Value
public class ConditionResult {

    boolean fired;
    BigDecimal movePercent;
    BigDecimal referencePrice;
    EvaluationReason reason;

    public static ConditionResult fired(BigDecimal movePercent, BigDecimal referencePrice) {
        return new ConditionResult(true, movePercent, referencePrice, EvaluationReason.FIRED);
    }

    public static ConditionResult notFired(
            EvaluationReason reason, BigDecimal movePercent, BigDecimal referencePrice) {
        return new ConditionResult(false, movePercent, referencePrice, reason);
    }

    public static ConditionResult noReference() {
        return new ConditionResult(false, null, null, EvaluationReason.NO_REFERENCE);
    }
}
