package com.docgate.model;

import com.docgate.model.error.MalformedIdentifierException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Maps externally visible ids to internal, namespaced document ids and back.
 * <p>
 * External user ids are the SHA-256 digest of the subject (64 hex characters); the internal id
 * prefixes it with {@code user_}. Hex case is accepted as given and never folded, so an
 * upper-case id maps to a different internal id than the lowercase digest. Tenant ids are
 * exposed as-is. Pure functions, no I/O and no state.
 */
public final class IdentifierMapper {

    private static final Pattern USER_PAYLOAD = Pattern.compile("[0-9a-fA-F]{64}");
    private static final Pattern TENANT_PAYLOAD = Pattern.compile("[A-Za-z0-9_-]+");
    private static final HexFormat HEX = HexFormat.of();

    private IdentifierMapper() {
        // utility class
    }

    /**
     * Returns the lowercase hex SHA-256 digest of a subject, which is also its external user id.
     *
     * @throws MalformedIdentifierException if the subject is null or blank
     */
    public static String externalIdForSubject(String subject) {
        if (subject == null || subject.isBlank()) {
            throw new MalformedIdentifierException(String.valueOf(subject), "subject must not be blank");
        }
        return HEX.formatHex(sha256().digest(subject.getBytes(StandardCharsets.UTF_8)));
    }

    /** Internal user id for a subject: {@code user_<sha256(subject)>}. */
    public static String userIdForSubject(String subject) {
        return DocumentKind.USER.prefix() + externalIdForSubject(subject);
    }

    /**
     * Resolves an external id to the internal id in the given namespace.
     *
     * @throws MalformedIdentifierException if the id has the wrong shape for the namespace
     */
    public static String externalToInternal(DocumentKind kind, String externalId) {
        if (externalId == null || externalId.isBlank()) {
            throw new MalformedIdentifierException(String.valueOf(externalId), "id must not be blank");
        }
        return switch (kind) {
            case USER -> {
                if (!USER_PAYLOAD.matcher(externalId).matches()) {
                    throw new MalformedIdentifierException(externalId,
                            "user id must be 64 hex characters");
                }
                yield DocumentKind.USER.prefix() + externalId;
            }
            case TENANT -> {
                requireTenantId(externalId);
                yield externalId;
            }
        };
    }

    /**
     * Strips the user namespace from an internal id; tenant ids are returned unchanged.
     *
     * @throws MalformedIdentifierException if the id belongs to neither namespace
     */
    public static String internalToExternal(String internalId) {
        return switch (kindOf(internalId)) {
            case USER -> internalId.substring(DocumentKind.USER.prefix().length());
            case TENANT -> internalId;
        };
    }

    /**
     * Returns the namespace of a well-formed internal id.
     *
     * @throws MalformedIdentifierException if the prefix or payload is invalid
     */
    public static DocumentKind kindOf(String internalId) {
        if (internalId == null) {
            throw new MalformedIdentifierException("null", "id must not be null");
        }
        if (internalId.startsWith(DocumentKind.USER.prefix())) {
            String payload = internalId.substring(DocumentKind.USER.prefix().length());
            if (!USER_PAYLOAD.matcher(payload).matches()) {
                throw new MalformedIdentifierException(internalId,
                        "user id payload must be 64 hex characters");
            }
            return DocumentKind.USER;
        }
        if (internalId.startsWith(DocumentKind.TENANT.prefix())) {
            requireTenantId(internalId);
            return DocumentKind.TENANT;
        }
        throw new MalformedIdentifierException(internalId, "expected prefix user_ or tenant_");
    }

    /** A new random tenant id. */
    public static String newTenantId() {
        return DocumentKind.TENANT.prefix() + UUID.randomUUID();
    }

    /**
     * Deterministic personal tenant id for a user, so concurrent bootstraps of the same subject
     * collide on one document id.
     */
    public static String personalTenantIdFor(String userId) {
        UUID uuid = UUID.nameUUIDFromBytes(("personal:" + userId).getBytes(StandardCharsets.UTF_8));
        return DocumentKind.TENANT.prefix() + uuid;
    }

    private static void requireTenantId(String id) {
        if (!id.startsWith(DocumentKind.TENANT.prefix())) {
            throw new MalformedIdentifierException(id, "tenant id must start with tenant_");
        }
        String payload = id.substring(DocumentKind.TENANT.prefix().length());
        if (!TENANT_PAYLOAD.matcher(payload).matches()) {
            throw new MalformedIdentifierException(id, "tenant id payload must be [A-Za-z0-9_-]+");
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
