package com.docgate.gateway.table;

import com.docgate.model.DocumentKind;
import com.docgate.model.error.InvalidRequestException;

/** The virtual tables exposed by the gateway. */
public enum Collection {
    USERS("users", DocumentKind.USER),
    TENANTS("tenants", DocumentKind.TENANT);

    private final String path;
    private final DocumentKind kind;

    Collection(String path, DocumentKind kind) {
        this.path = path;
        this.kind = kind;
    }

    /** Name as it appears in URLs, metrics and logs. */
    public String path() {
        return path;
    }

    public DocumentKind kind() {
        return kind;
    }

    public static Collection fromPath(String path) {
        for (Collection collection : values()) {
            if (collection.path.equals(path)) {
                return collection;
            }
        }
        throw new InvalidRequestException("unknown collection: " + path);
    }
}
