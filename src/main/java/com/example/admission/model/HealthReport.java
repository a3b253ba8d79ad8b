package com.example.admission.model;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of the counter store liveness and the configured limit table.
 */
public record HealthReport(
        String status,
        boolean storeReachable,
        String storeType,
        Instant lastStoreFailure,
        boolean failOpen,
        List<String> categoriesConfigured,
        List<Tier> tiers,
        Instant timestamp
) {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
}
