package com.cloudcostbuddy.normalization;

import java.math.BigDecimal;

/**
 * One provider service line after canonicalization.
 *
 * @param canonicalName taxonomy bucket, or a cleaned version of the original label
 * @param cost          non-negative amount
 * @param currency      ISO 4217 code
 * @param originalName  provider's raw label, kept for audit
 */
public record ServiceCost(
        String canonicalName,
        BigDecimal cost,
        String currency,
        String originalName
) {}
