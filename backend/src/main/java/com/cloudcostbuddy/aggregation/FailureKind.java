package com.cloudcostbuddy.aggregation;

/**
 * Why a provider did not contribute to an aggregation.
 */
public enum FailureKind {
    /**
     * The call did not finish within the provider timeout and was abandoned.
     */
    TIMEOUT,

    /**
     * The reader threw; network, credentials or API errors all land here.
     */
    PROVIDER_ERROR,

    /**
     * No reader is registered for the provider.
     */
    NO_READER
}
