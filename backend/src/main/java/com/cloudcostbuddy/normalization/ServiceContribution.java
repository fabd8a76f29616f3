package com.cloudcostbuddy.normalization;

import com.cloudcostbuddy.domain.model.CloudProvider;

import java.math.BigDecimal;

/**
 * Share of a combined service that came from one provider service line.
 */
public record ServiceContribution(
        CloudProvider provider,
        BigDecimal cost,
        String originalName
) {}
