package com.cloudcostbuddy.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which providers an alert rule or a dashboard query covers.
 */
public enum ProviderScope {
    AWS(CloudProvider.AWS),
    AZURE(CloudProvider.AZURE),
    GCP(CloudProvider.GCP),
    ALL(null);

    private final CloudProvider provider;

    ProviderScope(CloudProvider provider) {
        this.provider = provider;
    }

    /**
     * Providers covered by this scope, in declaration order.
     */
    public Set<CloudProvider> providers() {
        return provider == null
                ? EnumSet.allOf(CloudProvider.class)
                : EnumSet.of(provider);
    }

    public boolean isAll() {
        return provider == null;
    }

    public static ProviderScope of(CloudProvider provider) {
        return switch (provider) {
            case AWS -> AWS;
            case AZURE -> AZURE;
            case GCP -> GCP;
        };
    }
}
