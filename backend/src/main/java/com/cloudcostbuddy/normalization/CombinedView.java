package com.cloudcostbuddy.normalization;

import com.cloudcostbuddy.domain.model.CloudProvider;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Merged multi-cloud cost model.
 *
 * {@code combinedServices} is sorted by descending total cost, ties broken by
 * canonical name.
 */
public record CombinedView(
        BigDecimal totalCost,
        String currency,
        Map<CloudProvider, ProviderSummary> perProvider,
        List<CombinedService> combinedServices,
        Instant combinedAt
) {
    public CombinedView {
        perProvider = perProvider.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(perProvider));
        combinedServices = List.copyOf(combinedServices);
    }

    public static CombinedView empty(Instant combinedAt) {
        return new CombinedView(BigDecimal.ZERO, CostNormalizationService.DEFAULT_CURRENCY,
                Map.of(), List.of(), combinedAt);
    }
}
