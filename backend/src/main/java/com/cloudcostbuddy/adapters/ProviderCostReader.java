package com.cloudcostbuddy.adapters;

import com.cloudcostbuddy.domain.model.CloudProvider;

import java.time.LocalDate;

/**
 * Port interface for reading cost data from one cloud billing backend.
 *
 * ADAPTER PATTERN:
 * Each provider implements this once. Pagination, query construction,
 * credential refresh and currency conversion stay inside the adapter; the
 * engine only sees {@link RawCostData} or an exception.
 *
 * IMPLEMENTATION REQUIREMENTS:
 * 1. Safe for concurrent use; the aggregator calls readers from a thread pool
 * 2. Amounts already converted to the account currency
 * 3. Any failure surfaces as an exception; the engine does not inspect it
 */
public interface ProviderCostReader {

    /**
     * Returns the cloud provider this reader handles.
     */
    CloudProvider getProvider();

    /**
     * Cost for the current billing period (month to date).
     */
    RawCostData getCurrentPeriodCost();

    /**
     * Cost over a date range.
     *
     * @param start       first day (inclusive)
     * @param end         last day (exclusive)
     * @param granularity bucket size of the {@code trends} array
     */
    RawCostData getRange(LocalDate start, LocalDate end, Granularity granularity);
}
