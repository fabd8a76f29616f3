package com.cloudcostbuddy.normalization;

import java.math.BigDecimal;
import java.util.List;

/**
 * A canonical service merged across providers. The contributors sum exactly
 * to {@code totalCost}.
 */
public record CombinedService(
        String canonicalName,
        BigDecimal totalCost,
        String currency,
        List<ServiceContribution> contributors
) {
    public CombinedService {
        contributors = List.copyOf(contributors);
    }
}
