package com.cloudcostbuddy.adapters;

import com.cloudcostbuddy.domain.model.CloudProvider;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Unnormalized cost response from one provider.
 *
 * The payload keeps the provider's own shape. Expected fields, all optional:
 * <pre>
 * {
 *   "totalCost": 12.5 | "12.50",
 *   "currency": "USD",
 *   "period": { "start": "2024-05-01", "end": "2024-06-01" },
 *   "services": [ { "name" | "serviceName": "...", "cost": 1.0, "currency": "USD" } ],
 *   "trends":   [ { "date": "2024-05-01", "cost": 0.4 } ]
 * }
 * </pre>
 *
 * @param provider       provider that produced the payload
 * @param requestedStart start of the queried range (inclusive)
 * @param requestedEnd   end of the queried range (exclusive)
 * @param payload        provider response; may be null or malformed
 */
public record RawCostData(
        CloudProvider provider,
        LocalDate requestedStart,
        LocalDate requestedEnd,
        JsonNode payload
) {
    public RawCostData {
        Objects.requireNonNull(provider, "provider must not be null");
    }
}
