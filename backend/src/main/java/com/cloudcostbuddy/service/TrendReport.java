package com.cloudcostbuddy.service;

import com.cloudcostbuddy.aggregation.PartialFailure;
import com.cloudcostbuddy.analytics.TrendPoint;
import com.cloudcostbuddy.analytics.TrendStats;

import java.util.List;

/**
 * Zero-filled daily series of a window with its statistics.
 *
 * @param series   one point per day of the requested window
 * @param stats    statistics over {@code series}
 * @param failures providers left out of the series
 */
public record TrendReport(List<TrendPoint> series, TrendStats stats, List<PartialFailure> failures) {

    public TrendReport {
        series = List.copyOf(series);
        failures = List.copyOf(failures);
    }
}
