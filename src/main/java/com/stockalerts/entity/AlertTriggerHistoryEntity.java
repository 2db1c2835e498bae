package com.stockalerts.entity;

import com.stockalerts.domain.enums.AlertKindType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the alert_trigger_history table.
 *
 * <p>One row per dispatched notification, written after the delivery attempt so that the
 * outcome is recorded alongside the prices that fired it. Rows outlive the alert they refer to.
 */
@Entity
@Table(
        name = "alert_trigger_history",
        indexes = {@Index(name = "idx_trigger_history_alert", columnList = "alert_id")})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertTriggerHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "alert_id", nullable = false)
    private Long alertId;

    @Column(name = "symbol", nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind_type", columnDefinition = "varchar(20)")
    private AlertKindType kindType;

    @Column(name = "window_minutes")
    private Integer windowMinutes;

    @Column(name = "threshold_percent", precision = 8, scale = 4)
    private BigDecimal thresholdPercent;

    @Column(name = "current_price", precision = 19, scale = 4)
    private BigDecimal currentPrice;

    @Column(name = "reference_price", precision = 19, scale = 4)
    private BigDecimal referencePrice;

    @Column(name = "move_percent", precision = 10, scale = 2)
    private BigDecimal movePercent;

    @Column(name = "triggered_at", nullable = false)
    private Instant triggeredAt;

    @Column(name = "cooldown_recorded")
    private boolean cooldownRecorded;

    @Column(name = "notification_sent")
    private boolean notificationSent;

    @Column(name = "error_message", length = 500)
    private String errorMessage;
}
