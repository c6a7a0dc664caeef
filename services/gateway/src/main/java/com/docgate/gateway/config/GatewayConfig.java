package com.docgate.gateway.config;

import com.docgate.gateway.bootstrap.BootstrapManager;
import com.docgate.gateway.table.VirtualTableHandler;
import com.docgate.gateway.tenant.TenantContextCache;
import com.docgate.model.error.GatewayException;
import com.docgate.observability.HealthCheckRegistry;
import com.docgate.observability.OperationMetrics;
import com.docgate.observability.SensitiveDataRedactor;
import com.docgate.storage.BackendHealthCheck;
import com.docgate.storage.DocumentStore;
import com.docgate.storage.StorageBackend;
import com.docgate.storage.live.LiveBackend;
import com.docgate.storage.memory.MemoryBackend;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the storage backend, bootstrap, tenant cache, metrics and the virtual table handler.
 *
 * <p>{@code docgate.storage.backend} picks the backend: {@code memory} keeps everything in process,
 * {@code live} talks to a CouchDB-compatible server.
 */
@Configuration
@EnableConfigurationProperties({GatewayProperties.class, StorageProperties.class})
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Bean(destroyMethod = "close")
    public StorageBackend storageBackend(StorageProperties storage) {
        log.info("Using {} storage backend", storage.backend().name().toLowerCase());
        return switch (storage.backend()) {
            case MEMORY -> new MemoryBackend(storage.timeout());
            case LIVE -> new LiveBackend(storage.url(), storage.username(), storage.password(), storage.timeout());
        };
    }

    @Bean
    public DocumentStore documentStore(StorageBackend backend, GatewayProperties gateway) {
        return new DocumentStore(backend, gateway.database(), gateway.queryLimit());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public OperationMetrics operationMetrics(MeterRegistry registry, GatewayProperties gateway) {
        return new OperationMetrics(registry, gateway.serviceName(),
                e -> e instanceof GatewayException failure ? failure.kind().code() : "error");
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(StorageBackend backend, GatewayProperties gateway) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(BackendHealthCheck.COMPONENT,
                new BackendHealthCheck(backend, gateway.healthDegradedThreshold()));
        return registry;
    }

    @Bean
    public TenantContextCache tenantContextCache(GatewayProperties gateway) {
        return new TenantContextCache(gateway.cacheTtl(), gateway.cacheMaxSize());
    }

    @Bean
    public BootstrapManager bootstrapManager(DocumentStore store, Clock clock, GatewayProperties gateway) {
        return new BootstrapManager(store, clock, gateway.workspaceSuffix());
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public VirtualTableHandler virtualTableHandler(
            DocumentStore store,
            BootstrapManager bootstrap,
            TenantContextCache cache,
            OperationMetrics metrics,
            SensitiveDataRedactor redactor,
            Clock clock) {
        return new VirtualTableHandler(store, bootstrap, cache, metrics, redactor, clock);
    }

    @Bean
    public DatabaseInitializer databaseInitializer(DocumentStore store, HealthCheckRegistry health) {
        return new DatabaseInitializer(store, health);
    }
}
