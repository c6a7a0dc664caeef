package com.docgate.observability;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous probe of one dependency, such as the storage backend.
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Starts the probe.
     *
     * @return a future completing with the component's health; a future that fails or does not
     *         complete in time is reported as unhealthy by {@link HealthCheckRegistry}
     */
    CompletableFuture<ComponentHealth> check();
}
