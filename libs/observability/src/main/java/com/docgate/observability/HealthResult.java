package com.docgate.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate of all registered probes.
 *
 * @param status    worst status among {@code checks}
 * @param checks    per-component results keyed by component name
 * @param timestamp when the probes completed
 */
public record HealthResult(HealthStatus status, Map<String, ComponentHealth> checks, Instant timestamp) {

    public HealthResult {
        checks = Map.copyOf(checks);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
