package com.docgate.security;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Capabilities a requester can carry in its claims.
 * <p>
 * Every authenticated subject is a {@link #MEMBER}. {@link #USER_ADMINISTRATOR} additionally
 * allows deactivating other users and implies {@code MEMBER}.
 */
public enum Role {

    MEMBER("ROLE_MEMBER"),
    USER_ADMINISTRATOR("ROLE_USER_ADMIN");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The claim value, e.g. {@code ROLE_USER_ADMIN}. */
    public String value() {
        return value;
    }

    public Set<Role> impliedRoles() {
        return switch (this) {
            case USER_ADMINISTRATOR -> EnumSet.of(MEMBER);
            case MEMBER -> EnumSet.noneOf(Role.class);
        };
    }

    /** True if this role is {@code other} or implies it. */
    public boolean implies(Role other) {
        return this == other || impliedRoles().contains(other);
    }

    public static Optional<Role> fromString(String value) {
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
