package com.cloudcostbuddy.analytics;

import java.math.BigDecimal;

/**
 * Derived statistics over a daily cost series.
 *
 * @param averageDaily   arithmetic mean of daily cost
 * @param maxDaily       highest daily cost
 * @param minDaily       lowest daily cost
 * @param growthRate     (last - first) / first, 0 when first is 0
 * @param volatility     coefficient of variation (population std dev / mean)
 * @param highestDay     earliest day with the highest cost, null for an empty series
 * @param lowestDay      earliest day with the lowest cost, null for an empty series
 * @param dataPointCount number of days analyzed
 */
public record TrendStats(
        BigDecimal averageDaily,
        BigDecimal maxDaily,
        BigDecimal minDaily,
        double growthRate,
        double volatility,
        TrendPoint highestDay,
        TrendPoint lowestDay,
        int dataPointCount
) {
    public static TrendStats empty() {
        return new TrendStats(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                0.0, 0.0, null, null, 0);
    }
}
