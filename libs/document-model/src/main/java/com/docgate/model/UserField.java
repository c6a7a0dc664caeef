package com.docgate.model;

import java.util.Optional;

/** Fields of a {@link UserDocument} that the owning subject may change. */
public enum UserField {
    DISPLAY_NAME("displayName"),
    EMAIL("email"),
    ACTIVE_TENANT_ID("activeTenantId");

    private final String jsonName;

    UserField(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }

    public static Optional<UserField> fromJsonName(String name) {
        for (UserField field : values()) {
            if (field.jsonName.equals(name)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
