package com.cloudcostbuddy.service;

import com.cloudcostbuddy.aggregation.AggregationResult;
import com.cloudcostbuddy.aggregation.MultiCloudAggregator;
import com.cloudcostbuddy.aggregation.TrendSeries;
import com.cloudcostbuddy.alert.AlertEvaluator;
import com.cloudcostbuddy.alert.AlertStore;
import com.cloudcostbuddy.alert.EvaluationPassReport;
import com.cloudcostbuddy.analytics.TrendAnalyzer;
import com.cloudcostbuddy.analytics.TrendPoint;
import com.cloudcostbuddy.analytics.TrendStats;
import com.cloudcostbuddy.domain.model.AlertHistoryEntry;
import com.cloudcostbuddy.domain.model.ProviderScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Entry point for API and dashboard callers.
 *
 * RESPONSIBILITIES:
 * 1. Combined cost summary for a provider scope
 * 2. Daily trend statistics over a window, missing days counted as zero spend
 * 3. On-demand alert evaluation pass
 * 4. Alert history of a user
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CostInsightsService {

    static final int MAX_HISTORY_LIMIT = 500;

    private final MultiCloudAggregator aggregator;
    private final TrendAnalyzer trendAnalyzer;
    private final AlertEvaluator alertEvaluator;
    private final AlertStore alertStore;

    public AggregationResult getCombinedSummary(ProviderScope scope) {
        Objects.requireNonNull(scope, "scope must not be null");
        return aggregator.fetchCurrent(scope);
    }

    /**
     * Trend over {@code [start, end)}. Days without data from any healthy
     * provider appear with zero cost.
     *
     * @throws IllegalArgumentException if the window is empty or inverted
     */
    public TrendReport getTrendStats(ProviderScope scope, LocalDate start, LocalDate end) {
        Objects.requireNonNull(scope, "scope must not be null");
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("Invalid trend window: " + start + " to " + end);
        }

        TrendSeries series = aggregator.fetchTrend(scope, start, end);
        List<TrendPoint> filled = zeroFill(series.points(), start, end);
        TrendStats stats = trendAnalyzer.analyze(filled);

        log.debug("Trend for {} from {} to {}: {} days, {} reported, {} provider failures",
                scope, start, end, filled.size(), series.points().size(), series.failures().size());
        return new TrendReport(filled, stats, series.failures());
    }

    public EvaluationPassReport runEvaluationPass() {
        return alertEvaluator.runEvaluationPass();
    }

    /**
     * Most recent alerts of a user, newest first.
     */
    public List<AlertHistoryEntry> getAlertHistory(String ownerId, int limit) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        return alertStore.findHistory(ownerId, Math.min(limit, MAX_HISTORY_LIMIT));
    }

    static List<TrendPoint> zeroFill(List<TrendPoint> points, LocalDate start, LocalDate end) {
        Map<LocalDate, BigDecimal> byDate = points.stream()
                .collect(Collectors.toMap(TrendPoint::date, TrendPoint::cost, BigDecimal::add));

        List<TrendPoint> filled = new ArrayList<>();
        for (LocalDate day = start; day.isBefore(end); day = day.plusDays(1)) {
            filled.add(new TrendPoint(day, byDate.getOrDefault(day, BigDecimal.ZERO)));
        }
        return filled;
    }
}
