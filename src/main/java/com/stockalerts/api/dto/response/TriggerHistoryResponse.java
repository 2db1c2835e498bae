package com.stockalerts.api.dto.response;

import com.stockalerts.domain.enums.AlertKindType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class TriggerHistoryResponse {

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
    private boolean cooldownRecorded;
    private boolean notificationSent;
    private String errorMessage;
}
