package com.docgate.observability;

import java.util.UUID;

/**
 * Identifiers attached to every log line written while a gateway operation runs.
 * <p>
 * Values are copied into the SLF4J MDC by {@link CorrelationContextHolder}, so log patterns can
 * reference them as {@code %X{correlationId}}, {@code %X{tenantId}} and so on.
 *
 * @param correlationId unique id of the inbound request
 * @param tenantId      resolved tenant context (nullable until bootstrap has run)
 * @param userId        internal id of the requesting user (nullable for system work)
 * @param operation     operation name, e.g. {@code tenants.update}
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String userId,
        String operation
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_OPERATION = "operation";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Starts a new context with a random correlation id.
     */
    public static CorrelationContext start(String userId, String operation) {
        return new CorrelationContext(UUID.randomUUID().toString(), null, userId, operation);
    }

    /** Returns a copy carrying the resolved tenant. */
    public CorrelationContext withTenant(String newTenantId) {
        return new CorrelationContext(correlationId, newTenantId, userId, operation);
    }
}
