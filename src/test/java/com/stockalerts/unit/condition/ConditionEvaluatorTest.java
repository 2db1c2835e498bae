package com.stockalerts.unit.condition;

import static org.assertj.core.api.Assertions.assertThat;

import com.stockalerts.condition.ConditionContext;
import com.stockalerts.condition.ConditionEvaluator;
import com.stockalerts.condition.ConditionResult;
import com.stockalerts.domain.enums.EvaluationReason;
import com.stockalerts.domain.model.AlertKind;
import com.stockalerts.domain.model.WindowStats;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for ConditionEvaluator: gap and window conditions, inclusive boundaries, window-extreme
 * ties, session-open scoping and missing references.
 */
class ConditionEvaluatorTest {

    private final ConditionEvaluator conditionEvaluator = new ConditionEvaluator();

    private static WindowStats window(String high, String low) {
        return WindowStats.builder()
                .high(new BigDecimal(high))
                .low(new BigDecimal(low))
                .count(4)
                .build();
    }

    private ConditionResult gap(AlertKind kind, String threshold, String price, String baseline, boolean openWindow) {
        return conditionEvaluator.evaluate(ConditionContext.builder()
                .kind(kind)
                .thresholdPercent(new BigDecimal(threshold))
                .currentPrice(new BigDecimal(price))
                .gapBaseline(baseline == null ? null : new BigDecimal(baseline))
                .sessionOpenWindow(openWindow)
                .build());
    }

    private ConditionResult windowed(AlertKind kind, String threshold, String price, WindowStats stats) {
        return conditionEvaluator.evaluate(ConditionContext.builder()
                .kind(kind)
                .thresholdPercent(new BigDecimal(threshold))
                .currentPrice(new BigDecimal(price))
                .window(stats)
                .build());
    }

    @Nested
    @DisplayName("Gap alerts")
    class Gaps {

        @Test
        @DisplayName("gap up fires exactly at the threshold")
        void gapUpBoundaryInclusive() {
            ConditionResult result = gap(AlertKind.gapUp(), "8", "1080", "1000", true);

            assertThat(result.isFired()).isTrue();
            assertThat(result.getReason()).isEqualTo(EvaluationReason.FIRED);
            assertThat(result.getMovePercent()).isEqualByComparingTo("8.00");
            assertThat(result.getReferencePrice()).isEqualByComparingTo("1000");
        }

        @Test
        @DisplayName("gap up does not fire just below the threshold")
        void gapUpBelowThreshold() {
            ConditionResult result = gap(AlertKind.gapUp(), "8", "1079.99", "1000", true);

            assertThat(result.isFired()).isFalse();
            assertThat(result.getReason()).isEqualTo(EvaluationReason.THRESHOLD_NOT_MET);
        }

        @Test
        @DisplayName("gap down fires at or below the threshold; sign of threshold ignored")
        void gapDownNegativeThreshold() {
            assertThat(gap(AlertKind.gapDown(), "-8", "920", "1000", true).isFired()).isTrue();
            assertThat(gap(AlertKind.gapDown(), "8", "900", "1000", true).isFired()).isTrue();
            assertThat(gap(AlertKind.gapDown(), "8", "920.01", "1000", true).isFired()).isFalse();
        }

        @Test
        @DisplayName("gap alerts never fire outside the session-open window")
        void outsideOpenWindow() {
            ConditionResult result = gap(AlertKind.gapUp(), "8", "1200", "1000", false);

            assertThat(result.isFired()).isFalse();
            assertThat(result.getReason()).isEqualTo(EvaluationReason.OUTSIDE_SESSION_OPEN_WINDOW);
            assertThat(result.getMovePercent()).isEqualByComparingTo("20.00");
        }

        @Test
        @DisplayName("missing baseline is reported, not thrown")
        void missingBaseline() {
            ConditionResult result = gap(AlertKind.gapUp(), "8", "1080", null, true);

            assertThat(result.isFired()).isFalse();
            assertThat(result.getReason()).isEqualTo(EvaluationReason.NO_REFERENCE);
            assertThat(result.getMovePercent()).isNull();
        }
    }

    @Nested
    @DisplayName("Window alerts")
    class Windows {

        @Test
        @DisplayName("drop fires at or below high * (1 - t/100)")
        void dropFires() {
            ConditionResult result = windowed(AlertKind.dropWindow(60), "8", "92", window("100", "92"));

            assertThat(result.isFired()).isTrue();
            assertThat(result.getReferencePrice()).isEqualByComparingTo("100");
            assertThat(result.getMovePercent()).isEqualByComparingTo("-8.00");
        }

        @Test
        @DisplayName("drop does not fire above the threshold price")
        void dropNotFired() {
            ConditionResult result = windowed(AlertKind.dropWindow(60), "8", "92.01", window("100", "92.01"));

            assertThat(result.isFired()).isFalse();
            assertThat(result.getReason()).isEqualTo(EvaluationReason.THRESHOLD_NOT_MET);
        }

        @Test
        @DisplayName("spike fires at or above low * (1 + t/100)")
        void spikeFires() {
            ConditionResult result = windowed(AlertKind.spikeWindow(120), "1", "101", window("101", "100"));

            assertThat(result.isFired()).isTrue();
            assertThat(result.getMovePercent()).isEqualByComparingTo("1.00");
        }

        @Test
        @DisplayName("price equal to the window high never fires a drop, even at zero threshold")
        void tieAtHigh() {
            ConditionResult result = windowed(AlertKind.dropWindow(60), "0", "110", window("110", "98"));

            assertThat(result.isFired()).isFalse();
            assertThat(result.getReason()).isEqualTo(EvaluationReason.AT_WINDOW_EXTREME);
        }

        @Test
        @DisplayName("price equal to the window low never fires a spike")
        void tieAtLow() {
            ConditionResult result = windowed(AlertKind.spikeWindow(60), "0", "98", window("110", "98"));

            assertThat(result.isFired()).isFalse();
            assertThat(result.getReason()).isEqualTo(EvaluationReason.AT_WINDOW_EXTREME);
        }

        @Test
        @DisplayName("latest price at the new high after a dip does not fire a drop")
        void highAfterDip() {
            // 100, 105, 98, 110: the current price 110 is the high itself
            ConditionResult result = windowed(AlertKind.dropWindow(60), "8", "110", window("110", "98"));

            assertThat(result.isFired()).isFalse();
        }

        @Test
        @DisplayName("missing window stats are reported as no reference")
        void missingWindow() {
            ConditionResult result = windowed(AlertKind.dropWindow(60), "8", "90", null);

            assertThat(result.getReason()).isEqualTo(EvaluationReason.NO_REFERENCE);
        }
    }

    @Test
    @DisplayName("evaluation is pure: same inputs give equal results")
    void pure() {
        ConditionResult first = windowed(AlertKind.dropWindow(60), "5", "94.123", window("100", "94.123"));
        ConditionResult second = windowed(AlertKind.dropWindow(60), "5", "94.123", window("100", "94.123"));

        assertThat(first).isEqualTo(second);
        assertThat(first.getMovePercent()).isEqualByComparingTo("-5.88");
    }
}
