package com.cloudcostbuddy.aggregation;

import com.cloudcostbuddy.domain.model.CloudProvider;
import com.cloudcostbuddy.normalization.CombinedView;
import com.cloudcostbuddy.normalization.CostSnapshot;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Combined view plus the providers that could not be read.
 *
 * The view is always populated from whatever succeeded; an all-provider
 * failure yields a zero-valued view and one failure per provider.
 */
public record AggregationResult(
        CombinedView view,
        Map<CloudProvider, CostSnapshot> snapshots,
        List<PartialFailure> failures,
        Map<CloudProvider, ProviderStatus> providerStatus
) {
    public AggregationResult {
        snapshots = snapshots.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(snapshots));
        failures = List.copyOf(failures);
        providerStatus = providerStatus.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(providerStatus));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public boolean isHealthy(CloudProvider provider) {
        return snapshots.containsKey(provider);
    }

    /**
     * Healthy and built from a usable payload. A degraded snapshot carries a
     * placeholder zero, not a measured cost.
     */
    public boolean hasUsableData(CloudProvider provider) {
        CostSnapshot snapshot = snapshots.get(provider);
        return snapshot != null && !snapshot.degraded();
    }

    public boolean hasAnyUsableData() {
        return snapshots.values().stream().anyMatch(snapshot -> !snapshot.degraded());
    }

    /**
     * Cost reported by one healthy provider.
     */
    public Optional<BigDecimal> costOf(CloudProvider provider) {
        return Optional.ofNullable(snapshots.get(provider)).map(CostSnapshot::totalCost);
    }
}
