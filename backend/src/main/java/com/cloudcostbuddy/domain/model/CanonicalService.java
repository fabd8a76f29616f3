package com.cloudcostbuddy.domain.model;

/**
 * Fixed taxonomy that provider service labels are mapped into.
 */
public enum CanonicalService {
    COMPUTE("Compute"),
    STORAGE("Storage"),
    DATABASE("Database"),
    NETWORKING("Networking"),
    CDN("CDN"),
    ANALYTICS("Analytics"),
    CONTAINERS("Containers"),
    SERVERLESS("Serverless"),
    OTHER("Other");

    private final String label;

    CanonicalService(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
