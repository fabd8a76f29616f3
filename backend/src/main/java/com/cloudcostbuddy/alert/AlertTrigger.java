package com.cloudcostbuddy.alert;

import com.cloudcostbuddy.domain.model.ProviderScope;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A detected trigger before it is recorded.
 *
 * @param provider        provider (or ALL for summaries) the fact is about
 * @param currentValue    observed spend
 * @param comparisonValue threshold or baseline
 * @param message         notification body and history message
 * @param data            structured notification payload
 */
record AlertTrigger(
        ProviderScope provider,
        BigDecimal currentValue,
        BigDecimal comparisonValue,
        String message,
        Map<String, String> data
) {}
