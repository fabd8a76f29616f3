package com.cloudcostbuddy.analytics;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * Statistics over a normalized daily cost series.
 *
 * The series must be strictly increasing by date with one point per day.
 * Missing days are zero-filled by the caller; this class does not invent data.
 * All variance-based figures degrade to 0 instead of NaN.
 */
@Service
@Slf4j
public class TrendAnalyzer {

    private static final int MONEY_SCALE = 2;

    public TrendStats analyze(List<TrendPoint> series) {
        if (series == null || series.isEmpty()) {
            return TrendStats.empty();
        }
        requireStrictlyIncreasing(series);

        TrendPoint highest = series.get(0);
        TrendPoint lowest = series.get(0);
        BigDecimal sum = BigDecimal.ZERO;

        for (TrendPoint point : series) {
            sum = sum.add(point.cost());
            // Strict comparison keeps the earliest day on ties
            if (point.cost().compareTo(highest.cost()) > 0) {
                highest = point;
            }
            if (point.cost().compareTo(lowest.cost()) < 0) {
                lowest = point;
            }
        }

        int n = series.size();
        BigDecimal mean = sum.divide(BigDecimal.valueOf(n), MathContext.DECIMAL64);

        double growthRate = growthRate(series.get(0).cost(), series.get(n - 1).cost());
        double volatility = coefficientOfVariation(series, mean);

        log.debug("Analyzed {} days: avg={}, growth={}, volatility={}", n, mean, growthRate, volatility);

        return new TrendStats(
                mean.setScale(MONEY_SCALE, RoundingMode.HALF_UP),
                highest.cost(),
                lowest.cost(),
                growthRate,
                volatility,
                highest,
                lowest,
                n
        );
    }

    private double growthRate(BigDecimal first, BigDecimal last) {
        if (first.signum() == 0) {
            return 0.0;
        }
        return last.subtract(first).divide(first, MathContext.DECIMAL64).doubleValue();
    }

    private double coefficientOfVariation(List<TrendPoint> series, BigDecimal mean) {
        if (mean.signum() == 0 || series.size() < 2) {
            return 0.0;
        }
        BigDecimal squaredDeviations = BigDecimal.ZERO;
        for (TrendPoint point : series) {
            BigDecimal deviation = point.cost().subtract(mean);
            squaredDeviations = squaredDeviations.add(deviation.multiply(deviation));
        }
        BigDecimal variance = squaredDeviations.divide(BigDecimal.valueOf(series.size()), MathContext.DECIMAL64);
        double stdDev = variance.sqrt(MathContext.DECIMAL64).doubleValue();
        return stdDev / mean.doubleValue();
    }

    private void requireStrictlyIncreasing(List<TrendPoint> series) {
        for (int i = 1; i < series.size(); i++) {
            if (!series.get(i).date().isAfter(series.get(i - 1).date())) {
                throw new IllegalArgumentException(
                        "Trend series must be strictly increasing by date, found "
                                + series.get(i - 1).date() + " followed by " + series.get(i).date());
            }
        }
    }
}
