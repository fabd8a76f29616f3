package com.cloudcostbuddy.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * User-defined alert rule.
 *
 * Rules are created and edited by the API layer. The evaluation engine
 * treats them as read-only except for {@code lastTriggeredAt}, which it
 * advances on a successful trigger through a conditional update.
 */
@Entity
@Table(name = "alert_rules", indexes = {
    @Index(name = "idx_alert_rule_owner", columnList = "ownerId"),
    @Index(name = "idx_alert_rule_type_enabled", columnList = "type, enabled"),
    @Index(name = "idx_alert_rule_scope", columnList = "providerScope")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertRule {

    public static final int DEFAULT_SPIKE_PERCENTAGE = 20;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AlertType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private ProviderScope providerScope;

    /**
     * Budget amount, required for {@link AlertType#BUDGET_THRESHOLD}.
     */
    @Column(precision = 12, scale = 2)
    private BigDecimal thresholdValue;

    /**
     * Growth percentage, used by {@link AlertType#SPIKE_DETECTION}.
     */
    private Integer thresholdPercentage;

    @Column(nullable = false)
    private boolean enabled;

    /**
     * Set by the evaluator only. Null until the first trigger.
     */
    private Instant lastTriggeredAt;

    @Column(nullable = false)
    private Instant createdAt;

    public int effectiveSpikePercentage() {
        return thresholdPercentage != null ? thresholdPercentage : DEFAULT_SPIKE_PERCENTAGE;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (providerScope == null) {
            providerScope = ProviderScope.ALL;
        }
    }
}
