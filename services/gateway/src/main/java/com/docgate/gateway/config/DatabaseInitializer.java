package com.docgate.gateway.config;

import com.docgate.observability.HealthCheckRegistry;
import com.docgate.observability.HealthResult;
import com.docgate.storage.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/** Creates the gateway database on startup and reports backend health. */
public class DatabaseInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DatabaseInitializer.class);

    private final DocumentStore store;
    private final HealthCheckRegistry health;

    public DatabaseInitializer(DocumentStore store, HealthCheckRegistry health) {
        this.store = store;
        this.health = health;
    }

    @Override
    public void run(ApplicationArguments args) {
        store.ensureDatabase();
        HealthResult result = health.checkAll();
        if (result.isHealthy()) {
            log.info("Database {} ready on {} backend", store.database(), store.backend().name());
        } else {
            log.warn("Database {} ready but backend reports {}: {}", store.database(), result.status(), result.checks());
        }
    }
}
