package com.cloudcostbuddy.alert;

import com.cloudcostbuddy.adapters.Granularity;
import com.cloudcostbuddy.aggregation.AggregationResult;
import com.cloudcostbuddy.aggregation.MultiCloudAggregator;
import com.cloudcostbuddy.domain.model.ProviderScope;

import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Provider queries shared by all rules of one pass.
 *
 * Rules over the same scope and window reuse one upstream read. The first
 * rule to ask performs the fetch; concurrent askers wait for its result.
 * Discarded at the end of the pass.
 */
class EvaluationPassContext {

    private final MultiCloudAggregator aggregator;
    private final LocalDate today;
    private final Map<Query, CompletableFuture<AggregationResult>> results = new ConcurrentHashMap<>();

    EvaluationPassContext(MultiCloudAggregator aggregator, LocalDate today) {
        this.aggregator = aggregator;
        this.today = today;
    }

    LocalDate today() {
        return today;
    }

    AggregationResult current(ProviderScope scope) {
        return memoize(new Query(scope, null, null, null), () -> aggregator.fetchCurrent(scope));
    }

    AggregationResult range(ProviderScope scope, LocalDate start, LocalDate end, Granularity granularity) {
        return memoize(new Query(scope, start, end, granularity),
                () -> aggregator.fetchRange(scope, start, end, granularity));
    }

    private AggregationResult memoize(Query query, Supplier<AggregationResult> loader) {
        CompletableFuture<AggregationResult> mine = new CompletableFuture<>();
        CompletableFuture<AggregationResult> existing = results.putIfAbsent(query, mine);
        if (existing != null) {
            return existing.join();
        }
        try {
            AggregationResult result = loader.get();
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            results.remove(query, mine);
            mine.completeExceptionally(e);
            throw e;
        }
    }

    /** A null window means the provider's current billing period. */
    private record Query(ProviderScope scope, LocalDate start, LocalDate end, Granularity granularity) {}
}
