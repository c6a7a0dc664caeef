package com.docgate.security;

import com.docgate.model.IdentifierMapper;
import com.docgate.model.TenantDocument;
import com.docgate.model.UserDocument;
import com.docgate.model.VirtualDocument;
import com.docgate.model.error.ForbiddenException;

/**
 * Read, update and delete decisions for the virtual collections.
 * <p>
 * <ul>
 *   <li>Users: a subject reads and updates only its own document. Nobody deletes themselves;
 *       deleting others requires {@link Role#USER_ADMINISTRATOR}.</li>
 *   <li>Tenants: members read, the owner updates, and the owner deletes unless the tenant is the
 *       owner's active tenant. Personal tenants are never deleted and never gain members.</li>
 * </ul>
 * Decisions depend only on the arguments. The {@code require*} variants throw
 * {@link ForbiddenException} instead of returning false.
 */
public final class AccessControlEngine {

    private AccessControlEngine() {
        // utility class
    }

    public static boolean canRead(Requester requester, VirtualDocument document) {
        return switch (document.kind()) {
            case USER -> ((UserDocument) document).subject().equals(requester.subject());
            case TENANT -> ((TenantDocument) document).hasMember(requester.userId());
        };
    }

    public static boolean canUpdate(Requester requester, VirtualDocument document) {
        return switch (document.kind()) {
            case USER -> ((UserDocument) document).subject().equals(requester.subject());
            case TENANT -> ((TenantDocument) document).isOwnedBy(requester.userId());
        };
    }

    /**
     * @param activeTenantId the requester's current active tenant (nullable)
     */
    public static boolean canDelete(Requester requester, VirtualDocument document, String activeTenantId) {
        return switch (document.kind()) {
            case USER -> !((UserDocument) document).subject().equals(requester.subject())
                    && RoleChecker.hasRole(requester, Role.USER_ADMINISTRATOR);
            case TENANT -> ((TenantDocument) document).isOwnedBy(requester.userId())
                    && !((TenantDocument) document).personal()
                    && !document.id().equals(activeTenantId);
        };
    }

    /** Only the owner adds members, and never to a personal tenant. */
    public static boolean canAddMember(Requester requester, TenantDocument tenant) {
        return tenant.isOwnedBy(requester.userId()) && !tenant.personal();
    }

    /**
     * The owner may remove any other member; a member may remove itself. The owner can never be
     * removed.
     */
    public static boolean canRemoveMember(Requester requester, TenantDocument tenant, String memberId) {
        if (tenant.isOwnedBy(memberId)) {
            return false;
        }
        return tenant.isOwnedBy(requester.userId()) || requester.userId().equals(memberId);
    }

    public static void requireRead(Requester requester, VirtualDocument document) {
        if (!canRead(requester, document)) {
            throw new ForbiddenException("read", external(document));
        }
    }

    public static void requireUpdate(Requester requester, VirtualDocument document) {
        if (!canUpdate(requester, document)) {
            throw new ForbiddenException("update", external(document));
        }
    }

    public static void requireDelete(Requester requester, VirtualDocument document, String activeTenantId) {
        if (canDelete(requester, document, activeTenantId)) {
            return;
        }
        String reason = switch (document.kind()) {
            case USER -> ((UserDocument) document).subject().equals(requester.subject())
                    ? "users cannot delete themselves"
                    : "requires " + Role.USER_ADMINISTRATOR.value();
            case TENANT -> tenantDeleteReason(requester, (TenantDocument) document, activeTenantId);
        };
        throw new ForbiddenException("delete", external(document), reason);
    }

    private static String tenantDeleteReason(Requester requester, TenantDocument tenant, String activeTenantId) {
        if (!tenant.isOwnedBy(requester.userId())) {
            return "only the owner can delete a tenant";
        }
        return tenant.personal() ? "personal tenants cannot be deleted" : "tenant is the active tenant";
    }

    private static String external(VirtualDocument document) {
        return document.kind().value() + " " + IdentifierMapper.internalToExternal(document.id());
    }
}
