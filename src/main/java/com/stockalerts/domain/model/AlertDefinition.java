package com.stockalerts.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only copy of a user-defined alert, as listed from the alert store for one cycle.
 *
 * <p>The engine never mutates this object; the only field it writes back to the store is
 * {@code lastTriggeredAt}, through {@code AlertRepository.recordTrigger}. A fresh copy is
 * listed every cycle, so removals made by the owner are seen within one cycle.
 */
@Value
@Builder(toBuilder = true)
public class AlertDefinition {

    Long id;

    /** Opaque key identifying the notification recipient (a Telegram chat id). */
    String ownerKey;

    /** Exchange-qualified or bare symbol, stored upper-case. */
    String symbol;

    AlertKind kind;

    /** Threshold magnitude in percent, e.g. 8 for an 8% move. */
    BigDecimal thresholdPercent;

    Instant createdAt;
    Instant lastTriggeredAt;
}
