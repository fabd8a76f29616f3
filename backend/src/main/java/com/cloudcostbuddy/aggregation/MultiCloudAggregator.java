package com.cloudcostbuddy.aggregation;

import com.cloudcostbuddy.adapters.Granularity;
import com.cloudcostbuddy.adapters.ProviderCostReader;
import com.cloudcostbuddy.adapters.RawCostData;
import com.cloudcostbuddy.analytics.TrendPoint;
import com.cloudcostbuddy.config.EngineProperties;
import com.cloudcostbuddy.domain.model.CloudProvider;
import com.cloudcostbuddy.domain.model.ProviderScope;
import com.cloudcostbuddy.normalization.CostNormalizationService;
import com.cloudcostbuddy.normalization.CostSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Fans out to the provider readers of a scope and merges their answers.
 *
 * EXECUTION MODEL:
 * All provider calls of one request run concurrently on the provider read
 * executor and share one deadline of {@code providerTimeout}, so one slow
 * provider never holds back the others. A call still running at the deadline
 * is cancelled and its worker interrupted, which returns the thread to the
 * pool; readers must give up when interrupted. Timed-out calls are not
 * retried; the next evaluation cycle tries again.
 *
 * DEGRADE, DON'T FAIL:
 * Provider failures never propagate. They are reported as
 * {@link PartialFailure}s next to a view built from the healthy providers.
 */
@Service
@Slf4j
public class MultiCloudAggregator {

    private final Map<CloudProvider, ProviderCostReader> readers;
    private final CostNormalizationService normalizationService;
    private final EngineProperties properties;
    private final Executor executor;

    public MultiCloudAggregator(
            Map<CloudProvider, ProviderCostReader> readers,
            CostNormalizationService normalizationService,
            EngineProperties properties,
            @Qualifier("providerReadExecutor") Executor executor
    ) {
        this.readers = readers;
        this.normalizationService = normalizationService;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Current billing period (month to date) for every provider in scope.
     */
    public AggregationResult fetchCurrent(ProviderScope scope) {
        log.debug("Fetching current period costs for scope {}", scope);
        return aggregate(scope, ProviderCostReader::getCurrentPeriodCost);
    }

    /**
     * Cost over {@code [start, end)} for every provider in scope.
     */
    public AggregationResult fetchRange(ProviderScope scope, LocalDate start, LocalDate end,
                                        Granularity granularity) {
        log.debug("Fetching {} costs for scope {} from {} to {}", granularity, scope, start, end);
        return aggregate(scope, reader -> reader.getRange(start, end, granularity));
    }

    /**
     * Daily series over {@code [start, end)}, summed across healthy providers.
     * Days no provider reported are absent; callers zero-fill.
     */
    public TrendSeries fetchTrend(ProviderScope scope, LocalDate start, LocalDate end) {
        log.debug("Fetching daily trend for scope {} from {} to {}", scope, start, end);
        FanOut fanOut = fanOut(scope, reader -> reader.getRange(start, end, Granularity.DAILY));

        SortedMap<LocalDate, BigDecimal> byDate = new TreeMap<>();
        fanOut.responses().forEach((provider, raw) -> {
            RawCostData data = raw != null ? raw : new RawCostData(provider, start, end, null);
            for (TrendPoint point : normalizationService.normalizeTrend(data)) {
                if (!point.date().isBefore(start) && point.date().isBefore(end)) {
                    byDate.merge(point.date(), point.cost(), BigDecimal::add);
                }
            }
        });

        List<TrendPoint> points = byDate.entrySet().stream()
                .map(e -> new TrendPoint(e.getKey(), e.getValue()))
                .toList();
        return new TrendSeries(points, fanOut.failures());
    }

    private AggregationResult aggregate(ProviderScope scope,
                                        Function<ProviderCostReader, RawCostData> call) {
        FanOut fanOut = fanOut(scope, call);

        Map<CloudProvider, CostSnapshot> snapshots = new EnumMap<>(CloudProvider.class);
        fanOut.responses().forEach((provider, raw) -> snapshots.put(provider,
                normalizationService.normalize(raw != null ? raw : new RawCostData(provider, null, null, null))));

        Map<CloudProvider, ProviderStatus> status = new EnumMap<>(CloudProvider.class);
        snapshots.keySet().forEach(provider -> status.put(provider, ProviderStatus.ACTIVE));
        fanOut.failures().forEach(failure -> status.put(failure.provider(), ProviderStatus.ERROR));

        if (fanOut.failures().size() == scope.providers().size()) {
            log.warn("All providers failed for scope {}: {}", scope, fanOut.failures());
        } else if (!fanOut.failures().isEmpty()) {
            log.warn("Partial provider failure for scope {}: {}", scope, fanOut.failures());
        }

        return new AggregationResult(
                normalizationService.combineMultiCloudData(List.copyOf(snapshots.values())),
                snapshots,
                fanOut.failures(),
                status
        );
    }

    private FanOut fanOut(ProviderScope scope, Function<ProviderCostReader, RawCostData> call) {
        long deadline = System.nanoTime() + properties.getProviderTimeout().toNanos();
        Map<CloudProvider, FutureTask<RawCostData>> pending = new EnumMap<>(CloudProvider.class);
        List<PartialFailure> failures = new ArrayList<>();

        for (CloudProvider provider : scope.providers()) {
            ProviderCostReader reader = readers.get(provider);
            if (reader == null) {
                failures.add(new PartialFailure(provider, FailureKind.NO_READER,
                        "No cost reader configured for " + provider));
                continue;
            }
            FutureTask<RawCostData> task = new FutureTask<>(() -> call.apply(reader));
            try {
                executor.execute(task);
                pending.put(provider, task);
            } catch (RejectedExecutionException e) {
                log.error("Provider read executor rejected {} call", provider, e);
                failures.add(new PartialFailure(provider, FailureKind.PROVIDER_ERROR,
                        "Read rejected: " + e.getMessage()));
            }
        }

        Map<CloudProvider, RawCostData> responses = new EnumMap<>(CloudProvider.class);
        pending.forEach((provider, task) -> {
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                responses.put(provider, task.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                task.cancel(true);
                log.warn("{} cost read timed out after {}", provider, properties.getProviderTimeout());
                failures.add(new PartialFailure(provider, FailureKind.TIMEOUT,
                        "No response within " + properties.getProviderTimeout()));
            } catch (ExecutionException e) {
                failures.add(classify(provider, e.getCause() != null ? e.getCause() : e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                task.cancel(true);
                failures.add(new PartialFailure(provider, FailureKind.PROVIDER_ERROR,
                        "Interrupted while waiting for " + provider));
            }
        });

        failures.sort(Comparator.comparing(PartialFailure::provider));
        return new FanOut(responses, failures);
    }

    private PartialFailure classify(CloudProvider provider, Throwable cause) {
        log.warn("{} cost read failed: {}", provider, cause.toString());
        return new PartialFailure(provider, FailureKind.PROVIDER_ERROR, cause.toString());
    }

    private record FanOut(Map<CloudProvider, RawCostData> responses, List<PartialFailure> failures) {}
}
