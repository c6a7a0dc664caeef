package com.docgate.gateway.bootstrap;

import com.docgate.model.IdentifierMapper;
import com.docgate.model.TenantDocument;
import com.docgate.model.UserDocument;
import com.docgate.model.error.ConflictException;
import com.docgate.model.error.ForbiddenException;
import com.docgate.security.Claims;
import com.docgate.storage.DocumentStore;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings a first-time subject from {@link BootstrapState#NEEDS_BOOTSTRAP} to {@link
 * BootstrapState#READY}: user document, personal tenant, active tenant.
 *
 * <p>Every step is create-if-absent. Concurrent bootstraps of one subject race on the same
 * deterministic ids; the loser of each race gets a conflict, re-reads, and continues with the
 * winner's document. This is the only place where a conflict is an expected outcome.
 */
public class BootstrapManager {

    private static final Logger log = LoggerFactory.getLogger(BootstrapManager.class);

    private final DocumentStore store;
    private final Clock clock;
    private final String workspaceSuffix;

    public BootstrapManager(DocumentStore store, Clock clock, String workspaceSuffix) {
        if (store == null || clock == null) {
            throw new IllegalArgumentException("store and clock must not be null");
        }
        this.store = store;
        this.clock = clock;
        this.workspaceSuffix = workspaceSuffix;
    }

    public BootstrapState stateOf(Claims claims) {
        return store.find(IdentifierMapper.userIdForSubject(claims.subject()), UserDocument.class)
                .filter(user -> user.activeTenantId() != null)
                .map(user -> BootstrapState.READY)
                .orElse(BootstrapState.NEEDS_BOOTSTRAP);
    }

    /**
     * Resolves the subject's active tenant, creating whatever is missing.
     *
     * @throws ForbiddenException if the user has been deactivated
     */
    public BootstrapResult ensureReady(Claims claims) {
        String userId = IdentifierMapper.userIdForSubject(claims.subject());
        boolean userCreated = false;
        UserDocument user = store.find(userId, UserDocument.class).orElse(null);
        if (user == null) {
            try {
                user = store.create(UserDocument.forSubject(
                        claims.subject(), claims.displayName(), claims.email(), clock.instant()));
                userCreated = true;
                log.info("Created user {}", userId);
            } catch (ConflictException e) {
                log.debug("User {} created concurrently, re-reading", userId);
                user = reread(userId);
            }
        }
        if (user.deleted()) {
            throw new ForbiddenException("bootstrap", "user " + IdentifierMapper.internalToExternal(userId),
                    "user is deactivated");
        }
        if (user.activeTenantId() != null) {
            return new BootstrapResult(userId, user.activeTenantId(), userCreated, false);
        }

        String tenantId = user.personalTenantId() != null
                ? user.personalTenantId()
                : IdentifierMapper.personalTenantIdFor(userId);
        boolean tenantCreated = ensurePersonalTenant(tenantId, user, claims);
        String activeTenantId = activate(user, tenantId);
        return new BootstrapResult(userId, activeTenantId, userCreated, tenantCreated);
    }

    private boolean ensurePersonalTenant(String tenantId, UserDocument user, Claims claims) {
        TenantDocument existing = store.find(tenantId, TenantDocument.class).orElse(null);
        if (existing != null) {
            requireUsable(existing);
            return false;
        }
        try {
            store.create(TenantDocument.ownedBy(tenantId, user.id(), workspaceName(claims),
                    Map.of("autoCreated", true), true, clock.instant()));
            log.info("Created personal tenant {} for user {}", tenantId, user.id());
            return true;
        } catch (ConflictException e) {
            log.debug("Personal tenant {} created concurrently", tenantId);
            requireUsable(store.require(tenantId, TenantDocument.class));
            return false;
        }
    }

    private String activate(UserDocument user, String tenantId) {
        UserDocument current = user;
        for (int attempt = 1; ; attempt++) {
            try {
                store.put(current.withPersonalTenant(tenantId, clock.instant())
                        .withActiveTenant(tenantId, clock.instant()));
                log.info("User {} now active in tenant {}", user.id(), tenantId);
                return tenantId;
            } catch (ConflictException e) {
                current = reread(user.id());
                if (current.activeTenantId() != null) {
                    log.debug("User {} activated concurrently in {}", user.id(), current.activeTenantId());
                    return current.activeTenantId();
                }
                if (attempt == 2) {
                    throw e;
                }
            }
        }
    }

    private UserDocument reread(String userId) {
        return store.require(userId, UserDocument.class);
    }

    private void requireUsable(TenantDocument tenant) {
        if (tenant.deleted()) {
            throw new ForbiddenException("bootstrap", "tenant " + tenant.id(), "personal tenant was deleted");
        }
    }

    private String workspaceName(Claims claims) {
        String owner = claims.displayName();
        if ((owner == null || owner.isBlank()) && claims.email() != null && claims.email().indexOf('@') > 0) {
            owner = claims.email().substring(0, claims.email().indexOf('@'));
        }
        return owner == null || owner.isBlank() ? "Personal Workspace" : owner + workspaceSuffix;
    }
}
