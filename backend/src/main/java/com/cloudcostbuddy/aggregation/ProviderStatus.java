package com.cloudcostbuddy.aggregation;

/**
 * Dashboard status flag of a provider in one fetch.
 */
public enum ProviderStatus {
    ACTIVE,
    ERROR
}
