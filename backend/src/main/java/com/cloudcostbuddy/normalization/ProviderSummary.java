package com.cloudcostbuddy.normalization;

import java.math.BigDecimal;

/**
 * Per-provider line of a {@link CombinedView}.
 */
public record ProviderSummary(
        BigDecimal totalCost,
        String currency,
        int serviceCount,
        boolean degraded
) {}
