package com.docgate.gateway.bootstrap;

/**
 * Outcome of {@link BootstrapManager#ensureReady}.
 *
 * @param userId internal id of the user document
 * @param tenantId active tenant the request should proceed with
 * @param userCreated whether this call created the user document
 * @param tenantCreated whether this call created the personal tenant
 */
public record BootstrapResult(String userId, String tenantId, boolean userCreated, boolean tenantCreated) {}
