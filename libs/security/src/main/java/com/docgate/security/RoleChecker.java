package com.docgate.security;

/**
 * Role checks that honour the {@link Role} hierarchy.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    public static boolean hasRole(Requester requester, Role required) {
        return requester.roles().stream().anyMatch(granted -> granted.implies(required));
    }

    public static boolean hasAnyRole(Requester requester, Role... required) {
        for (Role role : required) {
            if (hasRole(requester, role)) {
                return true;
            }
        }
        return false;
    }
}
