package com.docgate.gateway.table;

import com.docgate.gateway.bootstrap.BootstrapManager;
import com.docgate.gateway.bootstrap.BootstrapResult;
import com.docgate.gateway.tenant.TenantContextCache;
import com.docgate.model.DocumentCodec;
import com.docgate.model.DocumentKind;
import com.docgate.model.IdentifierMapper;
import com.docgate.model.TenantDocument;
import com.docgate.model.TenantPatch;
import com.docgate.model.UserDocument;
import com.docgate.model.UserField;
import com.docgate.model.UserPatch;
import com.docgate.model.VirtualDocument;
import com.docgate.model.error.BackendUnavailableException;
import com.docgate.model.error.ConflictException;
import com.docgate.model.error.DocumentNotFoundException;
import com.docgate.model.error.ErrorKind;
import com.docgate.model.error.ForbiddenException;
import com.docgate.model.error.GatewayException;
import com.docgate.model.error.InvalidRequestException;
import com.docgate.observability.CorrelationContext;
import com.docgate.observability.CorrelationContextHolder;
import com.docgate.observability.OperationMetrics;
import com.docgate.observability.SensitiveDataRedactor;
import com.docgate.security.AccessControlEngine;
import com.docgate.security.Claims;
import com.docgate.security.ClaimsValidationResult;
import com.docgate.security.ClaimsValidator;
import com.docgate.security.PatchPolicy;
import com.docgate.security.Requester;
import com.docgate.storage.BulkWriteResult;
import com.docgate.storage.ChangesFeed;
import com.docgate.storage.DocumentStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The virtual {@code users} and {@code tenants} tables.
 *
 * <p>Every operation runs the same pipeline: validate the claims, resolve the tenant context (hint,
 * then cache, then bootstrap), map the external id, authorize against freshly read documents, and
 * write through the {@link DocumentStore}. Results are JSON views in the external id space.
 *
 * <p>Operations run under a {@link CorrelationContext} and are timed by {@link OperationMetrics}.
 * A write that loses a revision race in the backend is re-read, re-validated and retried once. A
 * stale {@code _rev} supplied by the caller fails immediately with a conflict.
 */
public class VirtualTableHandler {

    private static final Logger log = LoggerFactory.getLogger(VirtualTableHandler.class);

    private static final TypeReference<Map<String, Object>> BODY = new TypeReference<>() {};

    private static final String CONTEXT = "context";

    private final DocumentStore store;
    private final BootstrapManager bootstrap;
    private final TenantContextCache cache;
    private final OperationMetrics metrics;
    private final SensitiveDataRedactor redactor;
    private final Clock clock;

    public VirtualTableHandler(
            DocumentStore store,
            BootstrapManager bootstrap,
            TenantContextCache cache,
            OperationMetrics metrics,
            SensitiveDataRedactor redactor,
            Clock clock) {
        this.store = store;
        this.bootstrap = bootstrap;
        this.cache = cache;
        this.metrics = metrics;
        this.redactor = redactor;
        this.clock = clock;
    }

    /**
     * Resolves the tenant the requester acts in: the claims' tenant hint when it names a tenant the
     * requester belongs to, otherwise the cached or bootstrapped active tenant.
     */
    public String resolveTenantContext(Claims claims) {
        return execute(CONTEXT, "resolve", claims, RequestScope::tenantId);
    }

    /**
     * Reads one document.
     *
     * @throws DocumentNotFoundException if it does not exist or is soft-deleted
     * @throws ForbiddenException if it exists but the requester may not read it
     */
    public ObjectNode get(Collection collection, String externalId, Claims claims) {
        return execute(collection.path(), "get", claims, scope -> {
            VirtualDocument document = requireLive(collection, internalId(collection, externalId));
            AccessControlEngine.requireRead(scope.requester(), document);
            return DocumentViews.view(document);
        });
    }

    /** Tenants the requester is a member of, soft-deleted ones excluded. */
    public List<ObjectNode> listTenants(Claims claims) {
        return execute(Collection.TENANTS.path(), "list", claims, scope -> {
            String userId = scope.requester().userId();
            ObjectNode selector = selector(DocumentKind.TENANT);
            selector.putObject("memberIds").putArray("$all").add(userId);
            return store.query(selector, TenantDocument.class).stream()
                    .filter(tenant -> !tenant.deleted() && tenant.hasMember(userId))
                    .map(DocumentViews::view)
                    .toList();
        });
    }

    /** Applies a patch of mutable fields. */
    public ObjectNode update(Collection collection, String externalId, Claims claims, JsonNode body) {
        return execute(collection.path(), "update", claims, scope -> {
            String id = internalId(collection, externalId);
            log.info("Updating {} {} with {}", collection.path(), externalId, redacted(body));
            VirtualDocument written = writeWithRetry(() -> prepareUpdate(scope, collection, id, body));
            return DocumentViews.view(written);
        });
    }

    /** Creates a workspace tenant owned by the requester, who becomes its only member. */
    public ObjectNode createTenant(Claims claims, JsonNode body) {
        return execute(Collection.TENANTS.path(), "create", claims, scope -> {
            TenantDocument created = store.create(
                    (TenantDocument) prepareCreate(scope, body, IdentifierMapper.newTenantId()).document());
            log.info("Created tenant {} owned by {}", created.id(), scope.requester().userId());
            return DocumentViews.view(created);
        });
    }

    /** Soft-deletes a document. */
    public ObjectNode delete(Collection collection, String externalId, Claims claims) {
        return execute(collection.path(), "delete", claims, scope -> {
            String id = internalId(collection, externalId);
            VirtualDocument written = writeWithRetry(() -> prepareDelete(scope, collection, id, null));
            log.info("Deleted {} {}", collection.path(), externalId);
            return DocumentViews.deleted(externalId, written.rev());
        });
    }

    /**
     * Best-effort bulk write: each operation succeeds or fails on its own.
     *
     * @see #bulkWrite(Collection, Claims, List, BulkMode)
     */
    public List<BulkResult> bulkWrite(Collection collection, Claims claims, List<JsonNode> operations) {
        return bulkWrite(collection, claims, operations, BulkMode.BEST_EFFORT);
    }

    /**
     * Validates every operation with the single-document rules, then writes the valid ones in one
     * backend call. An operation is an update when it carries {@code _id}, a soft delete when it
     * also carries {@code "_deleted": true}, and a tenant creation when it has no {@code _id}.
     * Results are in input order.
     */
    public List<BulkResult> bulkWrite(
            Collection collection, Claims claims, List<JsonNode> operations, BulkMode mode) {
        return execute(collection.path(), "bulk", claims, scope -> {
            BulkResult[] results = new BulkResult[operations.size()];
            List<Integer> indexes = new ArrayList<>();
            List<Supplier<PreparedWrite>> preparers = new ArrayList<>();
            List<PreparedWrite> writes = new ArrayList<>();

            for (int i = 0; i < operations.size(); i++) {
                JsonNode operation = operations.get(i);
                try {
                    Supplier<PreparedWrite> preparer = bulkPreparer(scope, collection, operation);
                    writes.add(preparer.get());
                    preparers.add(preparer);
                    indexes.add(i);
                } catch (BackendUnavailableException e) {
                    throw e;
                } catch (GatewayException e) {
                    results[i] = BulkResult.failed(operationId(operation), e.kind(), e.getMessage());
                }
            }

            if (mode == BulkMode.ALL_OR_NOTHING && indexes.size() < operations.size()) {
                for (int k = 0; k < indexes.size(); k++) {
                    results[indexes.get(k)] = BulkResult.failed(external(writes.get(k).document()),
                            ErrorKind.INVALID_REQUEST, "batch rejected: another operation failed validation");
                }
                log.warn("Rejected bulk write of {} {}", operations.size(), collection.path());
                return List.of(results);
            }

            List<BulkWriteResult> written = store.bulkPut(writes.stream()
                    .filter(PreparedWrite::changed)
                    .map(PreparedWrite::document)
                    .toList());
            int next = 0;
            for (int k = 0; k < indexes.size(); k++) {
                PreparedWrite write = writes.get(k);
                String id = external(write.document());
                if (!write.changed()) {
                    results[indexes.get(k)] = BulkResult.written(id, write.document().rev());
                    continue;
                }
                BulkWriteResult outcome = written.get(next++);
                if (outcome.ok()) {
                    write.afterWrite().run();
                    results[indexes.get(k)] = BulkResult.written(id, outcome.rev());
                } else if (outcome.error() == ErrorKind.CONFLICT) {
                    results[indexes.get(k)] = retryBulkItem(id, preparers.get(k));
                } else {
                    results[indexes.get(k)] = BulkResult.failed(id, outcome.error(), outcome.reason());
                }
            }
            log.info("Bulk write of {} {}: {} written", operations.size(), collection.path(),
                    Arrays.stream(results).filter(BulkResult::ok).count());
            return List.of(results);
        });
    }

    /**
     * Changes after a numeric sequence, as served by single-node backends.
     *
     * @see #changes(Collection, Claims, String, Integer)
     */
    public ChangesPage changes(Collection collection, Claims claims, long since, Integer limit) {
        if (since < 0) {
            throw new InvalidRequestException("since must not be negative");
        }
        return changes(collection, claims, Long.toString(since), limit);
    }

    /**
     * Changes after {@code since} the requester may see, with the documents as they are now.
     * Soft-deleted documents are left out. The returned cursor also covers left-out changes.
     *
     * @param since {@code "0"} or a cursor from an earlier {@link ChangesPage#lastSeq()}, passed
     *              to the backend unchanged
     * @param limit maximum number of backend changes to scan, or null for all
     */
    public ChangesPage changes(Collection collection, Claims claims, String since, Integer limit) {
        return execute(collection.path(), "changes", claims, scope -> {
            if (since == null || since.isBlank()) {
                throw new InvalidRequestException("since must not be blank");
            }
            if (limit != null && limit <= 0) {
                throw new InvalidRequestException("limit must be positive");
            }
            ChangesFeed feed = store.changes(since, limit);
            List<ChangesPage.Entry> entries = feed.changes().stream()
                    .filter(change -> change.document() != null
                            && change.document().kind() == collection.kind()
                            && !change.document().deleted())
                    .filter(change -> AccessControlEngine.canRead(scope.requester(), change.document()))
                    .map(change -> new ChangesPage.Entry(
                            change.record().seq(),
                            IdentifierMapper.internalToExternal(change.record().docId()),
                            change.record().rev(),
                            DocumentViews.view(change.document())))
                    .toList();
            return new ChangesPage(entries, feed.lastSeq());
        });
    }

    /** Adds an existing user to a tenant. Adding a current member changes nothing. */
    public ObjectNode addMember(String tenantExternalId, Claims claims, String externalUserId) {
        return execute(Collection.TENANTS.path(), "addMember", claims, scope -> {
            String tenantId = internalId(Collection.TENANTS, tenantExternalId);
            String memberId = internalId(Collection.USERS, externalUserId);
            VirtualDocument written = writeWithRetry(() -> prepareAddMember(scope, tenantId, memberId));
            return DocumentViews.view(written);
        });
    }

    /**
     * Removes a member from a tenant. A member whose active tenant this was is moved back to its
     * personal tenant.
     */
    public ObjectNode removeMember(String tenantExternalId, Claims claims, String externalUserId) {
        return execute(Collection.TENANTS.path(), "removeMember", claims, scope -> {
            String tenantId = internalId(Collection.TENANTS, tenantExternalId);
            String memberId = internalId(Collection.USERS, externalUserId);
            VirtualDocument written = writeWithRetry(() -> prepareRemoveMember(scope, tenantId, memberId));
            reassignActiveTenant(memberId, tenantId);
            return DocumentViews.view(written);
        });
    }

    // --- pipeline -------------------------------------------------------------------------------

    private <T> T execute(String table, String operation, Claims claims, Function<RequestScope, T> work) {
        if (claims == null) {
            throw new InvalidRequestException("claims are required");
        }
        Requester requester = Requester.from(claims);
        CorrelationContext context = CorrelationContext.start(requester.userId(), table + "." + operation);
        return CorrelationContextHolder.callWithContext(context, () -> metrics.record(table, operation, () -> {
            try {
                ClaimsValidationResult validation = ClaimsValidator.validate(claims);
                if (!validation.valid()) {
                    throw new InvalidRequestException("invalid claims: " + String.join("; ", validation.errors()));
                }
                String tenantId = resolve(requester, claims);
                CorrelationContextHolder.updateTenant(tenantId);
                return work.apply(new RequestScope(requester, tenantId));
            } catch (ForbiddenException e) {
                log.warn("Denied {}.{}: {}", table, operation, e.getMessage());
                throw e;
            } catch (BackendUnavailableException e) {
                log.error("Storage backend failed during {}.{}: {}", table, operation, e.getMessage());
                throw e;
            }
        }));
    }

    private String resolve(Requester requester, Claims claims) {
        if (claims.tenantHint() != null) {
            TenantDocument tenant = (TenantDocument) requireLive(Collection.TENANTS, claims.tenantHint());
            if (!tenant.hasMember(requester.userId())) {
                throw new ForbiddenException("use", "tenant " + tenant.id(), "not a member");
            }
            return tenant.id();
        }
        Optional<String> cached = cache.get(claims.subject());
        if (cached.isPresent()) {
            return cached.get();
        }
        BootstrapResult result = bootstrap.ensureReady(claims);
        cache.put(claims.subject(), result.tenantId());
        return result.tenantId();
    }

    private VirtualDocument writeWithRetry(Supplier<PreparedWrite> prepare) {
        PreparedWrite write = prepare.get();
        if (!write.changed()) {
            return write.document();
        }
        VirtualDocument written;
        try {
            written = store.put(write.document());
        } catch (ConflictException e) {
            log.info("Revision race on {}, re-reading and retrying once", write.document().id());
            write = prepare.get();
            if (!write.changed()) {
                return write.document();
            }
            written = store.put(write.document());
        }
        write.afterWrite().run();
        return written;
    }

    private BulkResult retryBulkItem(String id, Supplier<PreparedWrite> preparer) {
        try {
            VirtualDocument written = writeOnce(preparer);
            return BulkResult.written(id, written.rev());
        } catch (BackendUnavailableException e) {
            throw e;
        } catch (GatewayException e) {
            return BulkResult.failed(id, e.kind(), e.getMessage());
        }
    }

    private VirtualDocument writeOnce(Supplier<PreparedWrite> preparer) {
        PreparedWrite write = preparer.get();
        if (!write.changed()) {
            return write.document();
        }
        VirtualDocument written = store.put(write.document());
        write.afterWrite().run();
        return written;
    }

    // --- preparation ----------------------------------------------------------------------------

    private PreparedWrite prepareUpdate(RequestScope scope, Collection collection, String id, JsonNode body) {
        VirtualDocument current = requireLive(collection, id);
        AccessControlEngine.requireUpdate(scope.requester(), current);
        return switch (collection) {
            case USERS -> prepareUserUpdate((UserDocument) current, PatchPolicy.userPatch(body));
            case TENANTS -> prepareTenantUpdate((TenantDocument) current, PatchPolicy.tenantPatch(body));
        };
    }

    private PreparedWrite prepareUserUpdate(UserDocument current, UserPatch patch) {
        requireRevision(current, patch.expectedRev());
        if (patch.touches(UserField.ACTIVE_TENANT_ID)) {
            TenantDocument tenant = (TenantDocument) requireLive(Collection.TENANTS,
                    patch.valueOf(UserField.ACTIVE_TENANT_ID));
            if (!tenant.hasMember(current.id())) {
                throw new ForbiddenException("activate", "tenant " + tenant.id(), "not a member");
            }
        }
        UserDocument next = current.apply(patch, clock.instant());
        return PreparedWrite.of(next, () -> {
            if (next.activeTenantId() != null) {
                cache.put(next.subject(), next.activeTenantId());
            }
        });
    }

    private PreparedWrite prepareTenantUpdate(TenantDocument current, TenantPatch patch) {
        requireRevision(current, patch.expectedRev());
        return PreparedWrite.of(current.apply(patch, clock.instant()));
    }

    private PreparedWrite prepareCreate(RequestScope scope, JsonNode body, String tenantId) {
        TenantPatch create = PatchPolicy.tenantCreate(body);
        return PreparedWrite.of(TenantDocument.ownedBy(tenantId, scope.requester().userId(), create.name(),
                create.metadata(), false, clock.instant()));
    }

    private PreparedWrite prepareDelete(RequestScope scope, Collection collection, String id, String expectedRev) {
        VirtualDocument current = requireLive(collection, id);
        return switch (collection) {
            case USERS -> {
                AccessControlEngine.requireDelete(scope.requester(), current, null);
                requireRevision(current, expectedRev);
                UserDocument user = (UserDocument) current;
                yield PreparedWrite.of(user.markDeleted(clock.instant()), () -> cache.invalidate(user.subject()));
            }
            case TENANTS -> {
                AccessControlEngine.requireDelete(scope.requester(), current, activeTenantOf(scope.requester()));
                requireRevision(current, expectedRev);
                long activeUsers = usersActiveIn(id);
                if (activeUsers > 0) {
                    throw new ForbiddenException("delete", "tenant " + id,
                            "tenant is the active tenant of %d user(s)".formatted(activeUsers));
                }
                TenantDocument tenant = (TenantDocument) current;
                yield PreparedWrite.of(tenant.markDeleted(clock.instant()), () -> cache.invalidateTenant(id));
            }
        };
    }

    private PreparedWrite prepareAddMember(RequestScope scope, String tenantId, String memberId) {
        TenantDocument tenant = (TenantDocument) requireLive(Collection.TENANTS, tenantId);
        if (!AccessControlEngine.canAddMember(scope.requester(), tenant)) {
            throw new ForbiddenException("add member to", "tenant " + tenantId,
                    tenant.personal() ? "personal tenants cannot gain members" : "only the owner can add members");
        }
        requireLive(Collection.USERS, memberId);
        if (tenant.hasMember(memberId)) {
            return PreparedWrite.unchanged(tenant);
        }
        log.info("Adding {} to tenant {}", memberId, tenantId);
        return PreparedWrite.of(tenant.withMember(memberId, clock.instant()));
    }

    private PreparedWrite prepareRemoveMember(RequestScope scope, String tenantId, String memberId) {
        TenantDocument tenant = (TenantDocument) requireLive(Collection.TENANTS, tenantId);
        if (!AccessControlEngine.canRemoveMember(scope.requester(), tenant, memberId)) {
            throw new ForbiddenException("remove member from", "tenant " + tenantId,
                    tenant.isOwnedBy(memberId) ? "the owner cannot be removed" : "only the owner can remove other members");
        }
        if (!tenant.hasMember(memberId)) {
            return PreparedWrite.unchanged(tenant);
        }
        log.info("Removing {} from tenant {}", memberId, tenantId);
        return PreparedWrite.of(tenant.withoutMember(memberId, clock.instant()));
    }

    private void reassignActiveTenant(String memberId, String tenantId) {
        Optional<UserDocument> member = store.find(memberId, UserDocument.class)
                .filter(user -> !user.deleted() && tenantId.equals(user.activeTenantId()));
        if (member.isEmpty()) {
            return;
        }
        writeWithRetry(() -> {
            UserDocument current = (UserDocument) requireLive(Collection.USERS, memberId);
            if (!tenantId.equals(current.activeTenantId())) {
                return PreparedWrite.unchanged(current);
            }
            String personal = current.personalTenantId() != null
                    ? current.personalTenantId()
                    : IdentifierMapper.personalTenantIdFor(memberId);
            UserDocument next = current.withActiveTenant(personal, clock.instant());
            return PreparedWrite.of(next, () -> cache.put(next.subject(), personal));
        });
        log.info("User {} left tenant {} and is back in its personal tenant", memberId, tenantId);
    }

    private Supplier<PreparedWrite> bulkPreparer(RequestScope scope, Collection collection, JsonNode operation) {
        if (operation == null || !operation.isObject()) {
            throw new InvalidRequestException("bulk operation must be a JSON object");
        }
        ObjectNode body = ((ObjectNode) operation).deepCopy();
        JsonNode idNode = body.remove("_id");
        JsonNode deletedNode = body.remove("_deleted");
        boolean delete = deletedNode != null && deletedNode.asBoolean(false);

        if (idNode == null || idNode.isNull()) {
            if (collection == Collection.USERS || delete) {
                throw new InvalidRequestException("_id is required");
            }
            String tenantId = IdentifierMapper.newTenantId();
            return () -> prepareCreate(scope, body, tenantId);
        }
        if (!idNode.isTextual()) {
            throw new InvalidRequestException("_id must be a string");
        }
        String id = internalId(collection, idNode.textValue());
        if (delete) {
            String rev = body.path(PatchPolicy.REV).isTextual() ? body.path(PatchPolicy.REV).textValue() : null;
            return () -> prepareDelete(scope, collection, id, rev);
        }
        return () -> prepareUpdate(scope, collection, id, body);
    }

    // --- lookups --------------------------------------------------------------------------------

    private VirtualDocument requireLive(Collection collection, String id) {
        return store.find(id)
                .filter(document -> document.kind() == collection.kind() && !document.deleted())
                .orElseThrow(() -> new DocumentNotFoundException(
                        collection.path() + "/" + IdentifierMapper.internalToExternal(id)));
    }

    private String activeTenantOf(Requester requester) {
        return store.find(requester.userId(), UserDocument.class)
                .map(UserDocument::activeTenantId)
                .orElse(null);
    }

    private long usersActiveIn(String tenantId) {
        ObjectNode selector = selector(DocumentKind.USER);
        selector.put("activeTenantId", tenantId);
        return store.query(selector, UserDocument.class).stream()
                .filter(user -> !user.deleted() && tenantId.equals(user.activeTenantId()))
                .count();
    }

    private static ObjectNode selector(DocumentKind kind) {
        ObjectNode selector = DocumentCodec.objectMapper().createObjectNode();
        selector.put("type", kind.value());
        selector.put("deleted", false);
        return selector;
    }

    private static String internalId(Collection collection, String externalId) {
        return IdentifierMapper.externalToInternal(collection.kind(), externalId);
    }

    private static String external(VirtualDocument document) {
        return IdentifierMapper.internalToExternal(document.id());
    }

    private static String operationId(JsonNode operation) {
        return operation != null && operation.path("_id").isTextual() ? operation.path("_id").textValue() : null;
    }

    private static void requireRevision(VirtualDocument current, String expectedRev) {
        if (expectedRev != null && !expectedRev.equals(current.rev())) {
            throw new ConflictException(current.kind().value() + " " + external(current),
                    "revision " + expectedRev + " is not current");
        }
    }

    private Object redacted(JsonNode body) {
        if (body == null || !body.isObject()) {
            return body;
        }
        return redactor.redact(DocumentCodec.objectMapper().convertValue(body, BODY));
    }

    private record RequestScope(Requester requester, String tenantId) {}

    private record PreparedWrite(VirtualDocument document, boolean changed, Runnable afterWrite) {

        static PreparedWrite of(VirtualDocument document) {
            return new PreparedWrite(document, true, () -> {});
        }

        static PreparedWrite of(VirtualDocument document, Runnable afterWrite) {
            return new PreparedWrite(document, true, afterWrite);
        }

        static PreparedWrite unchanged(VirtualDocument document) {
            return new PreparedWrite(document, false, () -> {});
        }
    }
}
