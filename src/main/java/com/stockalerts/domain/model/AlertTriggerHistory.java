package com.stockalerts.domain.model;

import com.stockalerts.domain.enums.AlertKindType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Audit record of one dispatched alert notification.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertTriggerHistory {

    private Long id;
    private Long alertId;
    private String symbol;
    private AlertKindType kindType;
    private Integer windowMinutes;
    private BigDecimal thresholdPercent;
    private BigDecimal currentPrice;
    private BigDecimal referencePrice;
    private BigDecimal movePercent;
    private Instant triggeredAt;

    /** Whether lastTriggeredAt reached the alert store before sending. */
    private boolean cooldownRecorded;

    private boolean notificationSent;
    private String errorMessage;
}
