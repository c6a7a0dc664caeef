package com.docgate.observability;

/**
 * Health of a single component or of the gateway as a whole, ordered from best to worst.
 */
public enum HealthStatus {

    HEALTHY,

    /** Reachable but impaired, e.g. slow to answer. */
    DEGRADED,

    UNHEALTHY;

    /** Returns the worse of this status and {@code other}. */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
