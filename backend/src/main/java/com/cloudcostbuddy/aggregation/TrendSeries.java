package com.cloudcostbuddy.aggregation;

import com.cloudcostbuddy.analytics.TrendPoint;

import java.util.List;

/**
 * Daily series merged across the healthy providers of a scope.
 */
public record TrendSeries(List<TrendPoint> points, List<PartialFailure> failures) {

    public TrendSeries {
        points = List.copyOf(points);
        failures = List.copyOf(failures);
    }
}
