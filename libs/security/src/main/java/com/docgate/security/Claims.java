package com.docgate.security;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Identity of an already-verified bearer token.
 * <p>
 * Signature and expiry checks happen before a {@code Claims} value exists; everything in here is
 * trusted.
 *
 * @param subject     identity-provider subject ({@code sub})
 * @param issuer      token issuer ({@code iss})
 * @param email       email claim (nullable)
 * @param displayName name claim (nullable)
 * @param tenantHint  tenant requested by the client for this call (nullable)
 * @param roles       granted roles; defaults to {@link Role#MEMBER}
 */
public record Claims(
        String subject,
        String issuer,
        String email,
        String displayName,
        String tenantHint,
        Set<Role> roles
) {

    public Claims {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
        roles = roles == null || roles.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.of(Role.MEMBER))
                : Collections.unmodifiableSet(EnumSet.copyOf(roles));
    }

    /** Claims of a plain member without a tenant hint. */
    public static Claims of(String subject, String issuer, String email, String displayName) {
        return new Claims(subject, issuer, email, displayName, null, Set.of(Role.MEMBER));
    }

    public Claims withTenantHint(String tenantId) {
        return new Claims(subject, issuer, email, displayName, tenantId, roles);
    }
}
