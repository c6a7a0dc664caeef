package com.docgate.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * A workspace shared by a set of users, one of whom owns it.
 * <p>
 * The owner is always a member; the constructor rejects any combination that breaks this, so
 * no code path can persist a tenant without its owner in {@code memberIds}.
 *
 * @param id        internal id, {@code tenant_<uuid>}
 * @param rev       current revision (null before the first write)
 * @param ownerId   internal user id of the owner
 * @param memberIds internal user ids of all members, owner included, in insertion order
 * @param name      display name
 * @param metadata  free-form metadata owned by the tenant owner
 * @param personal  true for the tenant created at bootstrap
 * @param deleted   soft-delete marker
 * @param createdAt creation time
 * @param updatedAt last modification time
 */
@JsonIgnoreProperties(value = {"type"}, allowGetters = true)
public record TenantDocument(
        @JsonProperty("_id") String id,
        @JsonProperty("_rev") String rev,
        String ownerId,
        List<String> memberIds,
        String name,
        Map<String, Object> metadata,
        boolean personal,
        boolean deleted,
        Instant createdAt,
        Instant updatedAt
) implements VirtualDocument {

    public TenantDocument {
        if (id == null || !id.startsWith(DocumentKind.TENANT.prefix())) {
            throw new IllegalArgumentException("tenant id must start with " + DocumentKind.TENANT.prefix());
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId must not be null or blank");
        }
        memberIds = memberIds == null ? List.of() : List.copyOf(new LinkedHashSet<>(memberIds));
        if (!memberIds.contains(ownerId)) {
            throw new IllegalArgumentException("owner %s must be a member of tenant %s".formatted(ownerId, id));
        }
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Creates a fresh, not yet stored tenant whose owner is its only member.
     */
    public static TenantDocument ownedBy(String tenantId, String ownerId, String name,
                                         Map<String, Object> metadata, boolean personal, Instant now) {
        return new TenantDocument(tenantId, null, ownerId, List.of(ownerId), name, metadata,
                personal, false, now, now);
    }

    @JsonProperty("type")
    public String type() {
        return DocumentKind.TENANT.value();
    }

    @Override
    public DocumentKind kind() {
        return DocumentKind.TENANT;
    }

    public boolean hasMember(String userId) {
        return memberIds.contains(userId);
    }

    public boolean isOwnedBy(String userId) {
        return ownerId.equals(userId);
    }

    @Override
    public TenantDocument withRevision(String newRev) {
        return new TenantDocument(id, newRev, ownerId, memberIds, name, metadata, personal,
                deleted, createdAt, updatedAt);
    }

    public TenantDocument withMember(String userId, Instant now) {
        List<String> members = new ArrayList<>(memberIds);
        members.add(userId);
        return new TenantDocument(id, rev, ownerId, members, name, metadata, personal,
                deleted, createdAt, now);
    }

    /**
     * Returns a copy without the given member.
     *
     * @throws IllegalArgumentException if the member is the owner
     */
    public TenantDocument withoutMember(String userId, Instant now) {
        List<String> members = new ArrayList<>(memberIds);
        members.remove(userId);
        return new TenantDocument(id, rev, ownerId, members, name, metadata, personal,
                deleted, createdAt, now);
    }

    public TenantDocument markDeleted(Instant now) {
        return new TenantDocument(id, rev, ownerId, memberIds, name, metadata, personal,
                true, createdAt, now);
    }

    /**
     * Applies the mutable-field changes of a patch.
     */
    public TenantDocument apply(TenantPatch patch, Instant now) {
        String newName = patch.name() != null ? patch.name() : name;
        Map<String, Object> newMetadata = patch.metadata() != null ? patch.metadata() : metadata;
        return new TenantDocument(id, rev, ownerId, memberIds, newName, newMetadata, personal,
                deleted, createdAt, now);
    }
}
