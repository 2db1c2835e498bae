package com.stockalerts.condition;

import com.stockalerts.domain.enums.AlertKindType;
import com.stockalerts.domain.enums.EvaluationReason;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Stateless evaluator for the four alert kinds.
 *
 * <p>With threshold magnitude {@code t}, current price {@code p}:
 * <pre>
 *   GAP_UP        p &gt;= r * (1 + t/100)      only inside the session-open window
 *   GAP_DOWN      p &lt;= r * (1 - t/100)      only inside the session-open window
 *   SPIKE_WINDOW  p &gt;= low * (1 + t/100)    and p != low
 *   DROP_WINDOW   p &lt;= high * (1 - t/100)   and p != high
 * </pre>
 * where {@code r} is the session gap baseline. Boundaries are inclusive. All arithmetic is exact
 * {@link BigDecimal}; only the reported move percent is rounded.
 *
 * <p>A missing or non-positive reference yields a not-fired result with reason
 * {@link EvaluationReason#NO_REFERENCE}; this class never throws for missing data.
 */
@Component
public class ConditionEvaluator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public ConditionResult evaluate(ConditionContext context) {
        AlertKindType type = context.getKind().getType();
        BigDecimal threshold = context.getThresholdPercent().abs();
        BigDecimal price = context.getCurrentPrice();

        return switch (type) {
            case GAP_UP -> evaluateGap(context, price, threshold, true);
            case GAP_DOWN -> evaluateGap(context, price, threshold, false);
            case SPIKE_WINDOW -> context.getWindow() == null
                    ? ConditionResult.noReference()
                    : evaluateAgainst(context.getWindow().getLow(), price, threshold, true, true);
            case DROP_WINDOW -> context.getWindow() == null
                    ? ConditionResult.noReference()
                    : evaluateAgainst(context.getWindow().getHigh(), price, threshold, false, true);
        };
    }

    private ConditionResult evaluateGap(
            ConditionContext context, BigDecimal price, BigDecimal threshold, boolean up) {
        BigDecimal baseline = context.getGapBaseline();
        if (!isUsable(baseline)) {
            return ConditionResult.noReference();
        }
        if (!context.isSessionOpenWindow()) {
            return ConditionResult.notFired(
                    EvaluationReason.OUTSIDE_SESSION_OPEN_WINDOW, movePercent(price, baseline), baseline);
        }
        return evaluateAgainst(baseline, price, threshold, up, false);
    }

    private ConditionResult evaluateAgainst(
            BigDecimal reference, BigDecimal price, BigDecimal threshold, boolean up, boolean windowExtreme) {
        if (!isUsable(reference)) {
            return ConditionResult.noReference();
        }
        BigDecimal move = movePercent(price, reference);
        if (windowExtreme && price.compareTo(reference) == 0) {
            return ConditionResult.notFired(EvaluationReason.AT_WINDOW_EXTREME, move, reference);
        }

        BigDecimal delta = reference.multiply(threshold.movePointLeft(2));
        boolean fired = up
                ? price.compareTo(reference.add(delta)) >= 0
                : price.compareTo(reference.subtract(delta)) <= 0;

        return fired
                ? ConditionResult.fired(move, reference)
                : ConditionResult.notFired(EvaluationReason.THRESHOLD_NOT_MET, move, reference);
    }

    /** (price - reference) / reference * 100, half-up to two places. */
    public static BigDecimal movePercent(BigDecimal price, BigDecimal reference) {
        return price.subtract(reference).multiply(HUNDRED).divide(reference, 2, RoundingMode.HALF_UP);
    }

    private static boolean isUsable(BigDecimal reference) {
        return reference != null && reference.signum() > 0;
    }
}
