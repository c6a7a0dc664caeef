package com.docgate.storage;

import com.docgate.observability.ComponentHealth;
import com.docgate.observability.HealthCheck;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Probes a {@link StorageBackend} with {@code GET /}. Answers slower than the degraded threshold
 * are reported as degraded, failures as unhealthy.
 */
public final class BackendHealthCheck implements HealthCheck {

    public static final String COMPONENT = "storage";

    private final StorageBackend backend;
    private final Duration degradedThreshold;

    public BackendHealthCheck(StorageBackend backend, Duration degradedThreshold) {
        if (backend == null) {
            throw new IllegalArgumentException("backend must not be null");
        }
        if (degradedThreshold == null || degradedThreshold.isNegative()) {
            throw new IllegalArgumentException("degradedThreshold must not be null or negative");
        }
        this.backend = backend;
        this.degradedThreshold = degradedThreshold;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        long start = System.nanoTime();
        return backend.submit(BackendPath.root(), RequestMethod.GET, null)
                .handle((info, error) -> {
                    long latencyMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
                    if (error != null) {
                        Throwable cause = error.getCause() != null ? error.getCause() : error;
                        return ComponentHealth.unhealthy(COMPONENT,
                                backend.name() + " backend unreachable: " + cause.getMessage(), latencyMs);
                    }
                    if (latencyMs > degradedThreshold.toMillis()) {
                        return ComponentHealth.degraded(COMPONENT,
                                "%s backend answered in %d ms".formatted(backend.name(), latencyMs), latencyMs);
                    }
                    return ComponentHealth.healthy(COMPONENT, latencyMs);
                });
    }
}
