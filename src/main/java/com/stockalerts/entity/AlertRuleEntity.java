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
 * JPA entity for the alert_rules table.
 *
 * <p>Rows are created and removed by the user-facing front end. The evaluation engine only
 * reads active rows and writes {@code last_triggered_at}. {@code window_minutes} is set for the
 * windowed kinds only.
 */
@Entity
@Table(
        name = "alert_rules",
        indexes = {@Index(name = "idx_alert_rules_active", columnList = "active")})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertRuleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_key", nullable = false)
    private String ownerKey;

    @Column(name = "symbol", nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind_type", nullable = false, columnDefinition = "varchar(20)")
    private AlertKindType kindType;

    @Column(name = "window_minutes")
    private Integer windowMinutes;

    @Column(name = "threshold_percent", nullable = false, precision = 8, scale = 4)
    private BigDecimal thresholdPercent;

    @Builder.Default
    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_triggered_at")
    private Instant lastTriggeredAt;
}
