package com.stockalerts.notification;

import com.stockalerts.domain.model.AlertKind;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Notification intent produced when an alert fires and passes the cooldown gate.
 */
@Value
@Builder
public class AlertNotification {

    Long alertId;
    String ownerKey;
    String symbol;
    AlertKind kind;
    BigDecimal thresholdPercent;
    BigDecimal currentPrice;
    BigDecimal referencePrice;
    BigDecimal movePercent;
    Instant triggeredAt;

    /** The price came from an expired cache entry after a feed failure. */
    boolean stalePrice;
}
