package com.cloudcostbuddy.analytics;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Daily cost for one calendar day.
 */
public record TrendPoint(LocalDate date, BigDecimal cost) {

    public TrendPoint {
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(cost, "cost must not be null");
        if (cost.signum() < 0) {
            throw new IllegalArgumentException("Daily cost must not be negative: " + cost);
        }
    }
}
