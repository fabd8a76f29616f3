package com.cloudcostbuddy.domain.model;

/**
 * Supported cloud providers.
 *
 * Each provider has distinct billing APIs, response shapes, pagination and
 * latency profiles. The normalization layer abstracts these differences.
 */
public enum CloudProvider {
    AWS("Amazon Web Services"),
    AZURE("Microsoft Azure"),
    GCP("Google Cloud Platform");

    private final String displayName;

    CloudProvider(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
