package com.docgate.gateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Storage backend selection bound from {@code docgate.storage.*}.
 *
 * @param backend {@code memory} for the in-process store, {@code live} for a CouchDB-compatible server
 * @param url server root, required for {@code live}
 * @param username basic-auth user (optional)
 * @param password basic-auth password (optional)
 * @param timeout how long a backend call may take
 */
@ConfigurationProperties(prefix = "docgate.storage")
@Validated
public record StorageProperties(
        Backend backend, String url, String username, String password, Duration timeout) {

    public enum Backend {
        MEMORY,
        LIVE
    }

    public StorageProperties {
        if (backend == null) {
            backend = Backend.MEMORY;
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            timeout = Duration.ofSeconds(30);
        }
        if (backend == Backend.LIVE && (url == null || url.isBlank())) {
            throw new IllegalArgumentException("docgate.storage.url is required for the live backend");
        }
    }
}
