package com.docgate.model;

import java.util.Optional;

/** The two virtual collections and the id namespace each one owns. */
public enum DocumentKind {
    USER("user", "user_"),
    TENANT("tenant", "tenant_");

    private final String value;
    private final String prefix;

    DocumentKind(String value, String prefix) {
        this.value = value;
        this.prefix = prefix;
    }

    /** Value of the {@code type} field on stored documents. */
    public String value() {
        return value;
    }

    /** Internal id prefix, including the trailing underscore. */
    public String prefix() {
        return prefix;
    }

    /**
     * Looks up a kind by its stored {@code type} value.
     *
     * @param value the string to match
     * @return the matching kind, or empty if not found
     */
    public static Optional<DocumentKind> fromType(String value) {
        for (DocumentKind kind : values()) {
            if (kind.value.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
