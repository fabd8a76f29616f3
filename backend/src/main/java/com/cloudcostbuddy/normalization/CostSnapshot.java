package com.cloudcostbuddy.normalization;

import com.cloudcostbuddy.domain.model.CloudProvider;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Normalized cost result for one provider over one period.
 *
 * {@code totalCost} equals the sum of {@code services} within 0.01. When the
 * provider payload cannot guarantee that, {@code services} is empty and
 * {@code totalCost} is authoritative. A {@code degraded} snapshot was built
 * from an unusable payload and carries zero cost.
 */
public record CostSnapshot(
        CloudProvider provider,
        BigDecimal totalCost,
        String currency,
        DatePeriod period,
        List<ServiceCost> services,
        boolean degraded,
        Instant normalizedAt
) {
    public CostSnapshot {
        services = List.copyOf(services);
    }
}
