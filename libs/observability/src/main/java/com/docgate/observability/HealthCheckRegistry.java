package com.docgate.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Named collection of {@link HealthCheck}s that are probed together.
 * <p>
 * All probes are started before any result is awaited, so the total wait is bounded by the
 * slowest probe, capped at the per-probe timeout.
 */
public final class HealthCheckRegistry {

    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT_MS);
    }

    public HealthCheckRegistry(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
    }

    /**
     * Registers a probe, replacing any previous one with the same name.
     */
    public void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    public boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    /**
     * Runs every registered probe and aggregates the worst status. No probes means healthy.
     */
    public HealthResult checkAll() {
        Map<String, CompletableFuture<ComponentHealth>> pending = new LinkedHashMap<>();
        checks.forEach((name, check) -> pending.put(name, start(check)));

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : pending.entrySet()) {
            ComponentHealth health = await(entry.getKey(), entry.getValue());
            results.put(entry.getKey(), health);
            overall = overall.worst(health.status());
        }
        return new HealthResult(overall, results, Instant.now());
    }

    public int size() {
        return checks.size();
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    private static CompletableFuture<ComponentHealth> start(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private ComponentHealth await(String name, CompletableFuture<ComponentHealth> future) {
        try {
            return future.orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ComponentHealth.unhealthy(name, "Timeout or error: " + cause, timeoutMs);
        }
    }
}
