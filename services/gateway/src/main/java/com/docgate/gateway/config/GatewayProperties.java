package com.docgate.gateway.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Gateway settings bound from {@code docgate.gateway.*}.
 *
 * <pre>
 * docgate:
 *   gateway:
 *     service-name: docgate-gateway
 *     database: docgate
 *     cache-ttl: 5m
 *     cache-max-size: 10000
 * </pre>
 *
 * @param serviceName value of the {@code service} tag on metrics
 * @param database logical database holding users and tenants
 * @param cacheTtl how long a resolved tenant context may be served from cache
 * @param cacheMaxSize maximum number of cached subjects
 * @param queryLimit maximum documents returned by one selector query
 * @param workspaceSuffix appended to the owner's name to name a personal tenant
 * @param healthDegradedThreshold backend answers slower than this are reported as degraded
 */
@ConfigurationProperties(prefix = "docgate.gateway")
@Validated
public record GatewayProperties(
        @NotBlank String serviceName,
        @NotBlank String database,
        Duration cacheTtl,
        @Positive long cacheMaxSize,
        @Positive int queryLimit,
        String workspaceSuffix,
        Duration healthDegradedThreshold) {

    /** Applies defaults before Bean Validation runs. */
    public GatewayProperties {
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = "docgate-gateway";
        }
        if (database == null || database.isBlank()) {
            database = "docgate";
        }
        if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero()) {
            cacheTtl = Duration.ofMinutes(5);
        }
        if (cacheMaxSize <= 0) {
            cacheMaxSize = 10_000;
        }
        if (queryLimit <= 0) {
            queryLimit = 1000;
        }
        if (workspaceSuffix == null || workspaceSuffix.isBlank()) {
            workspaceSuffix = "'s Workspace";
        }
        if (healthDegradedThreshold == null || healthDegradedThreshold.isNegative()) {
            healthDegradedThreshold = Duration.ofSeconds(1);
        }
    }
}
