package com.cloudcostbuddy.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Audit record of one alert trigger.
 *
 * Written exactly once per trigger and never updated or deleted by the
 * engine. Retention is handled outside the engine.
 */
@Entity
@Table(name = "alert_history", indexes = {
    @Index(name = "idx_alert_history_rule", columnList = "ruleId"),
    @Index(name = "idx_alert_history_owner", columnList = "ownerId, triggeredAt"),
    @Index(name = "idx_alert_history_triggered", columnList = "triggeredAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class AlertHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long ruleId;

    @Column(nullable = false, updatable = false, length = 64)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private AlertType alertType;

    @Column(nullable = false, updatable = false)
    private Instant triggeredAt;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal currentValue;

    /**
     * Threshold for budget rules, baseline for spike and summary rules.
     */
    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal comparisonValue;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 8)
    private ProviderScope provider;

    @Column(nullable = false, updatable = false, length = 2048)
    private String message;
}
