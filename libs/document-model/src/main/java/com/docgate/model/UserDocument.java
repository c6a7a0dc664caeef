package com.docgate.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * One record per authenticated subject.
 * <p>
 * The id is derived from the subject ({@link IdentifierMapper#userIdForSubject(String)}) and never
 * changes. Only {@code displayName}, {@code email} and {@code activeTenantId} can be changed by
 * a patch, see {@link UserPatch}.
 *
 * @param id               internal id, {@code user_<sha256(subject)>}
 * @param rev              current revision (null before the first write)
 * @param subject          identity-provider subject the document belongs to
 * @param displayName      human-readable name (nullable)
 * @param email            contact email (nullable)
 * @param activeTenantId   tenant used as the request context (null until bootstrapped)
 * @param personalTenantId tenant created for this user at bootstrap (null until bootstrapped)
 * @param deleted          soft-delete marker
 * @param createdAt        creation time
 * @param updatedAt        last modification time
 */
@JsonIgnoreProperties(value = {"type"}, allowGetters = true)
public record UserDocument(
        @JsonProperty("_id") String id,
        @JsonProperty("_rev") String rev,
        String subject,
        String displayName,
        String email,
        String activeTenantId,
        String personalTenantId,
        boolean deleted,
        Instant createdAt,
        Instant updatedAt
) implements VirtualDocument {

    public UserDocument {
        if (id == null || !id.startsWith(DocumentKind.USER.prefix())) {
            throw new IllegalArgumentException("user id must start with " + DocumentKind.USER.prefix());
        }
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
    }

    /**
     * Creates a fresh, not yet stored user document for a subject.
     */
    public static UserDocument forSubject(String subject, String displayName, String email, Instant now) {
        return new UserDocument(IdentifierMapper.userIdForSubject(subject), null, subject,
                displayName, email, null, null, false, now, now);
    }

    @JsonProperty("type")
    public String type() {
        return DocumentKind.USER.value();
    }

    @Override
    public DocumentKind kind() {
        return DocumentKind.USER;
    }

    /** True once the bootstrap has assigned an active tenant. */
    public boolean bootstrapped() {
        return activeTenantId != null;
    }

    @Override
    public UserDocument withRevision(String newRev) {
        return new UserDocument(id, newRev, subject, displayName, email, activeTenantId,
                personalTenantId, deleted, createdAt, updatedAt);
    }

    public UserDocument withActiveTenant(String tenantId, Instant now) {
        return new UserDocument(id, rev, subject, displayName, email, tenantId,
                personalTenantId, deleted, createdAt, now);
    }

    public UserDocument withPersonalTenant(String tenantId, Instant now) {
        return new UserDocument(id, rev, subject, displayName, email, activeTenantId,
                tenantId, deleted, createdAt, now);
    }

    public UserDocument markDeleted(Instant now) {
        return new UserDocument(id, rev, subject, displayName, email, activeTenantId,
                personalTenantId, true, createdAt, now);
    }

    /**
     * Applies the mutable-field changes of a patch.
     */
    public UserDocument apply(UserPatch patch, Instant now) {
        String newDisplayName = displayName;
        String newEmail = email;
        String newActiveTenantId = activeTenantId;
        for (Map.Entry<UserField, String> change : patch.changes().entrySet()) {
            switch (change.getKey()) {
                case DISPLAY_NAME -> newDisplayName = change.getValue();
                case EMAIL -> newEmail = change.getValue();
                case ACTIVE_TENANT_ID -> newActiveTenantId = change.getValue();
            }
        }
        return new UserDocument(id, rev, subject, newDisplayName, newEmail, newActiveTenantId,
                personalTenantId, deleted, createdAt, now);
    }
}
