package com.cloudcostbuddy.normalization;

import com.cloudcostbuddy.domain.model.CanonicalService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps provider service labels to the canonical service taxonomy.
 *
 * PURPOSE:
 * Each provider names the same kind of service differently:
 * - AWS: "Amazon Elastic Compute Cloud - Compute", "Amazon Simple Storage Service"
 * - Azure: "Virtual Machines", "SQL Database"
 * - GCP: "Compute Engine", "BigQuery"
 *
 * Services from different providers have no common key, so the combined
 * multi-cloud view merges them by canonical name.
 *
 * ALGORITHM:
 * 1. Exact match against the label table
 * 2. Case-insensitive substring match, either direction, first hit in table order
 * 3. Strip vendor prefixes, trim and capitalize; re-check the table with the
 *    cleaned name, otherwise keep it
 *
 * The mapping is lossy but never drops a service and is idempotent:
 * canonicalizing a result again returns the same result.
 */
@Component
public class ServiceNameCanonicalizer {

    public static final String UNKNOWN_SERVICE = "Unknown Service";

    private static final Pattern VENDOR_PREFIX =
            Pattern.compile("^(amazon|aws|azure|google|cloud)\\s+", Pattern.CASE_INSENSITIVE);

    // Order matters for substring matching
    private static final List<Map.Entry<String, CanonicalService>> LABELS = List.of(
            // Compute
            Map.entry("Amazon Elastic Compute Cloud - Compute", CanonicalService.COMPUTE),
            Map.entry("Amazon EC2-Instance", CanonicalService.COMPUTE),
            Map.entry("Virtual Machines", CanonicalService.COMPUTE),
            Map.entry("App Service", CanonicalService.COMPUTE),
            Map.entry("Compute Engine", CanonicalService.COMPUTE),
            Map.entry("Google Compute Engine", CanonicalService.COMPUTE),

            // Storage
            Map.entry("Amazon Simple Storage Service", CanonicalService.STORAGE),
            Map.entry("Amazon S3", CanonicalService.STORAGE),
            Map.entry("Cloud Storage", CanonicalService.STORAGE),
            Map.entry("Google Cloud Storage", CanonicalService.STORAGE),

            // Database
            Map.entry("Amazon Relational Database Service", CanonicalService.DATABASE),
            Map.entry("Amazon RDS", CanonicalService.DATABASE),
            Map.entry("Amazon DynamoDB", CanonicalService.DATABASE),
            Map.entry("Azure Database", CanonicalService.DATABASE),
            Map.entry("Azure Cosmos DB", CanonicalService.DATABASE),
            Map.entry("SQL Database", CanonicalService.DATABASE),
            Map.entry("Cloud SQL", CanonicalService.DATABASE),
            Map.entry("Google Cloud SQL", CanonicalService.DATABASE),

            // CDN
            Map.entry("Amazon CloudFront", CanonicalService.CDN),
            Map.entry("Content Delivery Network", CanonicalService.CDN),
            Map.entry("Cloud CDN", CanonicalService.CDN),

            // Networking
            Map.entry("Amazon Virtual Private Cloud", CanonicalService.NETWORKING),
            Map.entry("Virtual Network", CanonicalService.NETWORKING),
            Map.entry("VPC Network", CanonicalService.NETWORKING),

            // Analytics
            Map.entry("Amazon Redshift", CanonicalService.ANALYTICS),
            Map.entry("Azure Synapse Analytics", CanonicalService.ANALYTICS),
            Map.entry("BigQuery", CanonicalService.ANALYTICS),
            Map.entry("Google BigQuery", CanonicalService.ANALYTICS),

            // Containers
            Map.entry("Amazon Elastic Container Service", CanonicalService.CONTAINERS),
            Map.entry("Amazon ECS", CanonicalService.CONTAINERS),
            Map.entry("Amazon Elastic Kubernetes Service", CanonicalService.CONTAINERS),
            Map.entry("Azure Kubernetes Service", CanonicalService.CONTAINERS),
            Map.entry("Container Instances", CanonicalService.CONTAINERS),
            Map.entry("Google Kubernetes Engine", CanonicalService.CONTAINERS),
            Map.entry("Cloud Run", CanonicalService.CONTAINERS),

            // Serverless
            Map.entry("AWS Lambda", CanonicalService.SERVERLESS),
            Map.entry("Azure Functions", CanonicalService.SERVERLESS),
            Map.entry("Cloud Functions", CanonicalService.SERVERLESS),
            Map.entry("Google Cloud Functions", CanonicalService.SERVERLESS),

            // Taxonomy names map to themselves
            Map.entry("Compute", CanonicalService.COMPUTE),
            Map.entry("Storage", CanonicalService.STORAGE),
            Map.entry("Database", CanonicalService.DATABASE),
            Map.entry("Networking", CanonicalService.NETWORKING),
            Map.entry("CDN", CanonicalService.CDN),
            Map.entry("Analytics", CanonicalService.ANALYTICS),
            Map.entry("Containers", CanonicalService.CONTAINERS),
            Map.entry("Serverless", CanonicalService.SERVERLESS),
            Map.entry("Other", CanonicalService.OTHER)
    );

    private static final Map<String, CanonicalService> EXACT = new LinkedHashMap<>();

    static {
        for (Map.Entry<String, CanonicalService> entry : LABELS) {
            EXACT.putIfAbsent(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Convert a provider service label to its canonical name.
     */
    public String canonicalize(String serviceName) {
        if (serviceName == null || serviceName.isBlank()) {
            return UNKNOWN_SERVICE;
        }

        Optional<CanonicalService> mapped = lookup(serviceName);
        if (mapped.isPresent()) {
            return mapped.get().getLabel();
        }

        String cleaned = clean(serviceName);
        if (cleaned.isEmpty()) {
            return UNKNOWN_SERVICE;
        }

        return lookup(cleaned)
                .map(CanonicalService::getLabel)
                .orElse(cleaned);
    }

    /**
     * Whether the name is one of the fixed taxonomy buckets.
     */
    public boolean isTaxonomyName(String name) {
        for (CanonicalService service : CanonicalService.values()) {
            if (service.getLabel().equals(name)) {
                return true;
            }
        }
        return false;
    }

    private Optional<CanonicalService> lookup(String serviceName) {
        CanonicalService exact = EXACT.get(serviceName);
        if (exact != null) {
            return Optional.of(exact);
        }

        String lower = serviceName.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, CanonicalService> entry : LABELS) {
            String key = entry.getKey().toLowerCase(Locale.ROOT);
            if (lower.contains(key) || key.contains(lower)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    private String clean(String serviceName) {
        String cleaned = serviceName.trim();
        String previous;
        do {
            previous = cleaned;
            cleaned = VENDOR_PREFIX.matcher(cleaned).replaceFirst("").trim();
        } while (!cleaned.equals(previous));

        if (cleaned.isEmpty()) {
            return cleaned;
        }
        return Character.toUpperCase(cleaned.charAt(0)) + cleaned.substring(1);
    }
}
