package com.cloudcostbuddy.adapters;

/**
 * Time bucket size requested from a provider billing API.
 */
public enum Granularity {
    DAILY,
    MONTHLY
}
