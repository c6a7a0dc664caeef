package com.docgate.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A validated set of changes to a {@link TenantDocument}.
 *
 * @param expectedRev revision the caller based the change on (null when not supplied)
 * @param name        new name, or null to keep the current one
 * @param metadata    replacement metadata, or null to keep the current one
 */
public record TenantPatch(String expectedRev, String name, Map<String, Object> metadata) {

    public TenantPatch {
        if (name != null && name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (metadata != null) {
            metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        }
    }

    public boolean isEmpty() {
        return name == null && metadata == null;
    }
}
