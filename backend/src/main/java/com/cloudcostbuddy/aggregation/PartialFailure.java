package com.cloudcostbuddy.aggregation;

import com.cloudcostbuddy.domain.model.CloudProvider;

/**
 * A provider that failed within an otherwise successful fetch.
 */
public record PartialFailure(CloudProvider provider, FailureKind kind, String detail) {}
