package com.stockalerts.engine;

import com.stockalerts.domain.enums.CycleOutcome;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Summary of one evaluation cycle.
 */
@Value
@Builder
public class CycleReport {

    Instant startedAt;
    CycleOutcome outcome;
    int activeAlerts;
    int symbols;
    int alertsEvaluated;
    int alertsFired;
    int suppressedByCooldown;
    int notificationsSent;
    int deliveryFailures;

    @Singular
    List<String> failedSymbols;

    @Singular
    List<String> abandonedSymbols;

    long durationMillis;

    public static CycleReport skipped(Instant startedAt, CycleOutcome outcome) {
        return CycleReport.builder().startedAt(startedAt).outcome(outcome).build();
    }
}
