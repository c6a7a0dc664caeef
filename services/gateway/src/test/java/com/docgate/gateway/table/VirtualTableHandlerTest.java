package com.docgate.gateway.table;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.docgate.gateway.bootstrap.BootstrapManager;
import com.docgate.gateway.tenant.TenantContextCache;
import com.docgate.model.DocumentCodec;
import com.docgate.model.IdentifierMapper;
import com.docgate.model.TenantDocument;
import com.docgate.model.error.ConflictException;
import com.docgate.model.error.DocumentNotFoundException;
import com.docgate.model.error.ErrorKind;
import com.docgate.model.error.ForbiddenException;
import com.docgate.model.error.GatewayException;
import com.docgate.model.error.ImmutableFieldException;
import com.docgate.model.error.InvalidRequestException;
import com.docgate.model.error.MalformedIdentifierException;
import com.docgate.observability.OperationMetrics;
import com.docgate.observability.SensitiveDataRedactor;
import com.docgate.security.Claims;
import com.docgate.security.testing.TestClaimsFactory;
import com.docgate.storage.DocumentStore;
import com.docgate.storage.RequestMethod;
import com.docgate.storage.StorageBackend;
import com.docgate.storage.memory.MemoryBackend;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("VirtualTableHandler")
class VirtualTableHandlerTest {

    private final Claims alice = TestClaimsFactory.member("alice");
    private final Claims bob = TestClaimsFactory.member("bob");
    private final Claims admin = TestClaimsFactory.administrator("carol");

    private InterceptingBackend backend;
    private DocumentStore store;
    private TenantContextCache cache;
    private SimpleMeterRegistry registry;
    private VirtualTableHandler handler;

    @BeforeEach
    void setUp() {
        backend = new InterceptingBackend();
        store = new DocumentStore(backend, "docgate");
        store.ensureDatabase();
        cache = new TenantContextCache(Duration.ofMinutes(5), 1000);
        registry = new SimpleMeterRegistry();
        OperationMetrics metrics = new OperationMetrics(registry, "test",
                e -> e instanceof GatewayException failure ? failure.kind().code() : "error");
        BootstrapManager bootstrap = new BootstrapManager(store, Clock.systemUTC(), "'s Workspace");
        handler = new VirtualTableHandler(store, bootstrap, cache, metrics, new SensitiveDataRedactor(),
                Clock.systemUTC());
    }

    private static String ext(String subject) {
        return IdentifierMapper.externalIdForSubject(subject);
    }

    private static JsonNode json(String text) {
        return DocumentCodec.parse(text);
    }

    private String createTenant(Claims owner, String name) {
        return handler.createTenant(owner, json("{\"name\":\"" + name + "\"}")).get("_id").asText();
    }

    @Nested
    @DisplayName("first request of a new subject")
    class Bootstrap {

        @Test
        @DisplayName("ext_42 gets a user, a personal tenant and an active tenant")
        void bootstrapsExt42() {
            Claims claims = TestClaimsFactory.member("ext_42");

            String tenantId = handler.resolveTenantContext(claims);

            ObjectNode user = handler.get(Collection.USERS,
                    "e19684236b8bc1da4010e43b1af2039aa2ca568d8876355e8cb05e8fd9d58099", claims);
            assertThat(user.get("_id").asText())
                    .isEqualTo("e19684236b8bc1da4010e43b1af2039aa2ca568d8876355e8cb05e8fd9d58099");
            assertThat(user.get("subject").asText()).isEqualTo("ext_42");
            assertThat(user.get("activeTenantId").asText()).isEqualTo(tenantId);

            ObjectNode tenant = handler.get(Collection.TENANTS, tenantId, claims);
            assertThat(tenant.get("ownerId").asText()).isEqualTo(ext("ext_42"));
            assertThat(tenant.get("memberIds")).hasSize(1);
            assertThat(tenant.get("memberIds").get(0).asText()).isEqualTo(ext("ext_42"));
            assertThat(tenant.get("name").asText()).isEqualTo("User ext_42's Workspace");
            assertThat(tenant.get("personal").asBoolean()).isTrue();
            assertThat(tenant.path("metadata").path("autoCreated").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("repeated requests reuse the same tenant")
        void idempotent() {
            String first = handler.resolveTenantContext(alice);
            cache.invalidate(alice.subject());

            assertThat(handler.resolveTenantContext(alice)).isEqualTo(first);
            assertThat(handler.listTenants(alice)).hasSize(1);
        }

        @Test
        @DisplayName("a tenant hint is honoured only for members")
        void tenantHint() {
            handler.resolveTenantContext(bob);
            String team = createTenant(alice, "Team");

            assertThat(handler.resolveTenantContext(alice.withTenantHint(team))).isEqualTo(team);
            assertThatThrownBy(() -> handler.resolveTenantContext(bob.withTenantHint(team)))
                    .isInstanceOf(ForbiddenException.class);
        }
    }

    @Nested
    @DisplayName("users")
    class Users {

        @BeforeEach
        void bootstrapBoth() {
            handler.resolveTenantContext(alice);
            handler.resolveTenantContext(bob);
        }

        @Test
        @DisplayName("a subject reads itself but not others")
        void readSelfOnly() {
            assertThat(handler.get(Collection.USERS, ext("alice"), alice).get("subject").asText()).isEqualTo("alice");
            assertThatThrownBy(() -> handler.get(Collection.USERS, ext("bob"), alice))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("missing and malformed ids are distinct errors")
        void missingVersusMalformed() {
            assertThatThrownBy(() -> handler.get(Collection.USERS, ext("nobody"), alice))
                    .isInstanceOf(DocumentNotFoundException.class);
            assertThatThrownBy(() -> handler.get(Collection.USERS, "abc", alice))
                    .isInstanceOf(MalformedIdentifierException.class);
        }

        @Test
        @DisplayName("a subject updates its mutable fields")
        void updateSelf() {
            String rev = handler.get(Collection.USERS, ext("alice"), alice).get("_rev").asText();

            ObjectNode updated = handler.update(Collection.USERS, ext("alice"), alice,
                    json("{\"displayName\":\"Alice A.\"}"));

            assertThat(updated.get("displayName").asText()).isEqualTo("Alice A.");
            assertThat(updated.get("_rev").asText()).isNotEqualTo(rev);
        }

        @Test
        @DisplayName("an immutable field rejects the whole patch")
        void immutableRejected() {
            assertThatThrownBy(() -> handler.update(Collection.USERS, ext("alice"), alice,
                    json("{\"displayName\":\"X\",\"subject\":\"mallory\"}")))
                    .isInstanceOf(ImmutableFieldException.class);

            ObjectNode user = handler.get(Collection.USERS, ext("alice"), alice);
            assertThat(user.get("subject").asText()).isEqualTo("alice");
            assertThat(user.get("displayName").asText()).isEqualTo("User alice");
        }

        @Test
        @DisplayName("nobody updates someone else")
        void updateOthers() {
            assertThatThrownBy(() -> handler.update(Collection.USERS, ext("bob"), alice,
                    json("{\"displayName\":\"X\"}")))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("the active tenant must be a tenant the user belongs to")
        void activeTenantMembership() {
            String bobPersonal = handler.resolveTenantContext(bob);

            assertThatThrownBy(() -> handler.update(Collection.USERS, ext("alice"), alice,
                    json("{\"activeTenantId\":\"" + bobPersonal + "\"}")))
                    .isInstanceOf(ForbiddenException.class);
            assertThatThrownBy(() -> handler.update(Collection.USERS, ext("alice"), alice,
                    json("{\"activeTenantId\":\"tenant_missing\"}")))
                    .isInstanceOf(DocumentNotFoundException.class);
        }

        @Test
        @DisplayName("switching tenant updates the cached context")
        void switchTenant() {
            String team = createTenant(alice, "Team");

            handler.update(Collection.USERS, ext("alice"), alice, json("{\"activeTenantId\":\"" + team + "\"}"));

            assertThat(cache.get("alice")).contains(team);
            assertThat(handler.resolveTenantContext(alice)).isEqualTo(team);
        }

        @Test
        @DisplayName("deleting yourself is always forbidden")
        void noSelfDelete() {
            assertThatThrownBy(() -> handler.delete(Collection.USERS, ext("alice"), alice))
                    .isInstanceOf(ForbiddenException.class);
            assertThatThrownBy(() -> handler.delete(Collection.USERS, ext("carol"), admin))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("an administrator deactivates another user")
        void adminDeletes() {
            assertThatThrownBy(() -> handler.delete(Collection.USERS, ext("bob"), alice))
                    .isInstanceOf(ForbiddenException.class);

            ObjectNode result = handler.delete(Collection.USERS, ext("bob"), admin);

            assertThat(result.get("ok").asBoolean()).isTrue();
            assertThat(store.find(IdentifierMapper.userIdForSubject("bob")).orElseThrow().deleted()).isTrue();
            assertThatThrownBy(() -> handler.listTenants(bob)).isInstanceOf(ForbiddenException.class);
        }
    }

    @Nested
    @DisplayName("tenants")
    class Tenants {

        @BeforeEach
        void bootstrapBoth() {
            handler.resolveTenantContext(alice);
            handler.resolveTenantContext(bob);
        }

        @Test
        @DisplayName("the creator becomes owner and sole member")
        void create() {
            ObjectNode tenant = handler.createTenant(alice, json("{\"name\":\"Team\",\"metadata\":{\"plan\":\"pro\"}}"));

            assertThat(tenant.get("_id").asText()).startsWith("tenant_");
            assertThat(tenant.get("ownerId").asText()).isEqualTo(ext("alice"));
            assertThat(tenant.get("memberIds")).hasSize(1);
            assertThat(tenant.get("personal").asBoolean()).isFalse();
            assertThat(tenant.path("metadata").path("plan").asText()).isEqualTo("pro");
            assertThat(handler.listTenants(alice)).hasSize(2);
            assertThat(handler.listTenants(bob)).hasSize(1);
        }

        @Test
        @DisplayName("members read, only the owner updates")
        void readAndUpdate() {
            String team = createTenant(alice, "Team");
            handler.addMember(team, alice, ext("bob"));

            assertThat(handler.get(Collection.TENANTS, team, bob).get("name").asText()).isEqualTo("Team");
            assertThatThrownBy(() -> handler.update(Collection.TENANTS, team, bob, json("{\"name\":\"Mine\"}")))
                    .isInstanceOf(ForbiddenException.class);
            assertThat(handler.update(Collection.TENANTS, team, alice, json("{\"name\":\"Renamed\"}"))
                    .get("name").asText()).isEqualTo("Renamed");
        }

        @Test
        @DisplayName("outsiders get forbidden, unknown ids not found")
        void forbiddenVersusNotFound() {
            String team = createTenant(alice, "Team");

            assertThatThrownBy(() -> handler.get(Collection.TENANTS, team, bob))
                    .isInstanceOf(ForbiddenException.class);
            assertThatThrownBy(() -> handler.get(Collection.TENANTS, "tenant_missing", bob))
                    .isInstanceOf(DocumentNotFoundException.class);
        }

        @Test
        @DisplayName("ownership survives a rejected patch")
        void ownerIdImmutable() {
            String team = createTenant(alice, "Team");

            assertThatThrownBy(() -> handler.update(Collection.TENANTS, team, alice,
                    json("{\"ownerId\":\"" + ext("bob") + "\",\"name\":\"Stolen\"}")))
                    .isInstanceOfSatisfying(ImmutableFieldException.class,
                            e -> assertThat(e.fields()).containsExactly("ownerId"));

            ObjectNode tenant = handler.get(Collection.TENANTS, team, alice);
            assertThat(tenant.get("ownerId").asText()).isEqualTo(ext("alice"));
            assertThat(tenant.get("name").asText()).isEqualTo("Team");
        }

        @Test
        @DisplayName("a stale revision is a conflict")
        void staleRevision() {
            String team = createTenant(alice, "Team");

            assertThatThrownBy(() -> handler.update(Collection.TENANTS, team, alice,
                    json("{\"_rev\":\"1-stale\",\"name\":\"B\"}")))
                    .isInstanceOf(ConflictException.class);
        }

        @Test
        @DisplayName("a lost revision race is retried against the fresh document")
        void raceRetried() {
            String team = createTenant(alice, "Team");
            backend.beforeNextPut(() -> {
                TenantDocument current = store.find(team, TenantDocument.class).orElseThrow();
                store.put(new TenantDocument(current.id(), current.rev(), current.ownerId(), current.memberIds(),
                        current.name(), Map.of("plan", "pro"), false, false, current.createdAt(),
                        current.updatedAt()));
            });

            ObjectNode updated = handler.update(Collection.TENANTS, team, alice, json("{\"name\":\"Renamed\"}"));

            assertThat(updated.get("name").asText()).isEqualTo("Renamed");
            assertThat(updated.path("metadata").path("plan").asText()).isEqualTo("pro");
        }

        @Test
        @DisplayName("a tenant cannot be deleted while it is anyone's active tenant")
        void activeTenantProtected() {
            String bobPersonal = handler.resolveTenantContext(bob);
            String team = createTenant(alice, "Team");
            handler.addMember(team, alice, ext("bob"));
            handler.update(Collection.USERS, ext("bob"), bob, json("{\"activeTenantId\":\"" + team + "\"}"));

            assertThatThrownBy(() -> handler.delete(Collection.TENANTS, team, alice))
                    .isInstanceOf(ForbiddenException.class)
                    .hasMessageContaining("active tenant of 1 user");

            handler.update(Collection.USERS, ext("bob"), bob,
                    json("{\"activeTenantId\":\"" + bobPersonal + "\"}"));
            assertThat(handler.delete(Collection.TENANTS, team, alice).get("ok").asBoolean()).isTrue();

            assertThatThrownBy(() -> handler.get(Collection.TENANTS, team, alice))
                    .isInstanceOf(DocumentNotFoundException.class);
            assertThat(handler.listTenants(alice)).hasSize(1);
        }

        @Test
        @DisplayName("owners cannot delete their active or personal tenant, members cannot delete at all")
        void deleteRules() {
            String personal = handler.resolveTenantContext(alice);
            String team = createTenant(alice, "Team");
            handler.addMember(team, alice, ext("bob"));

            assertThatThrownBy(() -> handler.delete(Collection.TENANTS, personal, alice))
                    .isInstanceOf(ForbiddenException.class);
            assertThatThrownBy(() -> handler.delete(Collection.TENANTS, team, bob))
                    .isInstanceOf(ForbiddenException.class);

            handler.update(Collection.USERS, ext("alice"), alice, json("{\"activeTenantId\":\"" + team + "\"}"));
            assertThatThrownBy(() -> handler.delete(Collection.TENANTS, team, alice))
                    .isInstanceOf(ForbiddenException.class)
                    .hasMessageContaining("active tenant");
        }
    }

    @Nested
    @DisplayName("members")
    class Members {

        private String team;

        @BeforeEach
        void setUpTeam() {
            handler.resolveTenantContext(alice);
            handler.resolveTenantContext(bob);
            team = createTenant(alice, "Team");
        }

        @Test
        @DisplayName("adding a member twice changes nothing")
        void addIdempotent() {
            String rev = handler.addMember(team, alice, ext("bob")).get("_rev").asText();

            ObjectNode again = handler.addMember(team, alice, ext("bob"));

            assertThat(again.get("_rev").asText()).isEqualTo(rev);
            assertThat(again.get("memberIds")).hasSize(2);
        }

        @Test
        @DisplayName("only the owner adds, and only users that exist")
        void addRules() {
            handler.addMember(team, alice, ext("bob"));

            assertThatThrownBy(() -> handler.addMember(team, bob, ext("carol")))
                    .isInstanceOf(ForbiddenException.class);
            assertThatThrownBy(() -> handler.addMember(team, alice, ext("nobody")))
                    .isInstanceOf(DocumentNotFoundException.class);
            assertThatThrownBy(() -> handler.addMember(handler.resolveTenantContext(alice), alice, ext("bob")))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("the owner can never be removed")
        void ownerStays() {
            handler.addMember(team, alice, ext("bob"));

            assertThatThrownBy(() -> handler.removeMember(team, alice, ext("alice")))
                    .isInstanceOf(ForbiddenException.class);
            assertThatThrownBy(() -> handler.removeMember(team, bob, ext("alice")))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("a member leaving its active tenant goes back to its personal tenant")
        void leaveActiveTenant() {
            String bobPersonal = handler.resolveTenantContext(bob);
            handler.addMember(team, alice, ext("bob"));
            handler.update(Collection.USERS, ext("bob"), bob, json("{\"activeTenantId\":\"" + team + "\"}"));

            ObjectNode tenant = handler.removeMember(team, bob, ext("bob"));

            assertThat(tenant.get("memberIds")).hasSize(1);
            assertThat(handler.get(Collection.USERS, ext("bob"), bob).get("activeTenantId").asText())
                    .isEqualTo(bobPersonal);
            assertThat(handler.resolveTenantContext(bob)).isEqualTo(bobPersonal);
            assertThatThrownBy(() -> handler.get(Collection.TENANTS, team, bob))
                    .isInstanceOf(ForbiddenException.class);
        }
    }

    @Nested
    @DisplayName("bulkWrite()")
    class BulkWrite {

        private String t1;
        private String t2;
        private String t3;

        @BeforeEach
        void setUpTenants() {
            handler.resolveTenantContext(alice);
            t1 = createTenant(alice, "One");
            t2 = createTenant(alice, "Two");
            t3 = createTenant(alice, "Three");
        }

        @Test
        @DisplayName("an immutable-field operation fails alone")
        void okImmutableOk() {
            List<BulkResult> results = handler.bulkWrite(Collection.TENANTS, alice, List.of(
                    json("{\"_id\":\"" + t1 + "\",\"name\":\"A\"}"),
                    json("{\"_id\":\"" + t2 + "\",\"ownerId\":\"x\"}"),
                    json("{\"_id\":\"" + t3 + "\",\"name\":\"C\"}")));

            assertThat(results).extracting(BulkResult::ok).containsExactly(true, false, true);
            assertThat(results.get(1).error()).isEqualTo(ErrorKind.IMMUTABLE_FIELD);
            assertThat(results.get(1).id()).isEqualTo(t2);
            assertThat(handler.get(Collection.TENANTS, t1, alice).get("name").asText()).isEqualTo("A");
            assertThat(handler.get(Collection.TENANTS, t2, alice).get("name").asText()).isEqualTo("Two");
            assertThat(handler.get(Collection.TENANTS, t3, alice).get("name").asText()).isEqualTo("C");
        }

        @Test
        @DisplayName("creates and soft-deletes in one call")
        void createAndDelete() {
            List<BulkResult> results = handler.bulkWrite(Collection.TENANTS, alice, List.of(
                    json("{\"name\":\"New\"}"),
                    json("{\"_id\":\"" + t1 + "\",\"_deleted\":true}")));

            assertThat(results).allMatch(BulkResult::ok);
            assertThat(results.get(0).id()).startsWith("tenant_");
            assertThat(handler.listTenants(alice))
                    .extracting(tenant -> tenant.get("name").asText())
                    .contains("New")
                    .doesNotContain("One");
        }

        @Test
        @DisplayName("all-or-nothing writes nothing when one operation is invalid")
        void allOrNothing() {
            List<BulkResult> results = handler.bulkWrite(Collection.TENANTS, alice, List.of(
                    json("{\"_id\":\"" + t1 + "\",\"name\":\"X\"}"),
                    json("{\"_id\":\"" + t2 + "\",\"ownerId\":\"x\"}")), BulkMode.ALL_OR_NOTHING);

            assertThat(results).noneMatch(BulkResult::ok);
            assertThat(results.get(0).error()).isEqualTo(ErrorKind.INVALID_REQUEST);
            assertThat(handler.get(Collection.TENANTS, t1, alice).get("name").asText()).isEqualTo("One");
        }

        @Test
        @DisplayName("reports malformed operations per item")
        void malformedItems() {
            List<BulkResult> results = handler.bulkWrite(Collection.USERS, alice, List.of(
                    json("{\"displayName\":\"no id\"}"),
                    json("{\"_id\":\"" + ext("alice") + "\",\"displayName\":\"Ann\"}")));

            assertThat(results.get(0).ok()).isFalse();
            assertThat(results.get(0).error()).isEqualTo(ErrorKind.INVALID_REQUEST);
            assertThat(results.get(1).ok()).isTrue();
            assertThat(results.get(1).id()).isEqualTo(ext("alice"));
        }
    }

    @Nested
    @DisplayName("changes()")
    class Changes {

        @Test
        @DisplayName("is ascending, resumable and empty until the next write")
        void ascendingAndResumable() {
            handler.resolveTenantContext(alice);
            createTenant(alice, "Team");

            ChangesPage page = handler.changes(Collection.TENANTS, alice, 0, null);
            assertThat(page.results()).hasSize(2);
            assertThat(page.results()).extracting(ChangesPage.Entry::seq).isSorted().doesNotHaveDuplicates();

            assertThat(handler.changes(Collection.TENANTS, alice, page.lastSeq(), null).results()).isEmpty();

            String next = createTenant(alice, "Next");
            ChangesPage after = handler.changes(Collection.TENANTS, alice, page.lastSeq(), null);
            assertThat(after.results()).extracting(ChangesPage.Entry::id).containsExactly(next);
            assertThat(after.results().get(0).seq()).isGreaterThan(Long.parseLong(page.lastSeq()));
        }

        @Test
        @DisplayName("shows only documents the requester may read")
        void visibility() {
            handler.resolveTenantContext(alice);
            handler.resolveTenantContext(bob);

            assertThat(handler.changes(Collection.USERS, alice, 0, null).results())
                    .extracting(ChangesPage.Entry::id)
                    .containsExactly(ext("alice"));
            assertThat(handler.changes(Collection.TENANTS, alice, 0, null).results())
                    .extracting(entry -> entry.doc().get("ownerId").asText())
                    .containsOnly(ext("alice"));
        }

        @Test
        @DisplayName("hides soft-deleted tenants")
        void hidesDeleted() {
            handler.resolveTenantContext(alice);
            String team = createTenant(alice, "Team");
            handler.delete(Collection.TENANTS, team, alice);

            assertThat(handler.changes(Collection.TENANTS, alice, 0, null).results())
                    .extracting(ChangesPage.Entry::id)
                    .doesNotContain(team);
        }

        @Test
        @DisplayName("rejects a negative cursor")
        void negativeSince() {
            assertThatThrownBy(() -> handler.changes(Collection.USERS, alice, -1, null))
                    .isInstanceOf(InvalidRequestException.class);
        }
    }

    @Test
    @DisplayName("denials are counted by outcome")
    void metrics() {
        handler.resolveTenantContext(alice);
        handler.resolveTenantContext(bob);

        assertThatThrownBy(() -> handler.get(Collection.USERS, ext("bob"), alice))
                .isInstanceOf(ForbiddenException.class);

        Counter failures = registry.find(OperationMetrics.FAILURES_COUNTER)
                .tags(OperationMetrics.TAG_COLLECTION, "users",
                        OperationMetrics.TAG_OPERATION, "get",
                        OperationMetrics.TAG_OUTCOME, "forbidden")
                .counter();
        assertThat(failures).isNotNull();
        assertThat(failures.count()).isEqualTo(1.0);
    }

    /** Memory backend that can run a competing write just before the next PUT. */
    static final class InterceptingBackend implements StorageBackend {

        private final MemoryBackend delegate = new MemoryBackend();
        private Runnable beforeNextPut;

        void beforeNextPut(Runnable hook) {
            this.beforeNextPut = hook;
        }

        @Override
        public CompletableFuture<JsonNode> submit(String path, RequestMethod method, JsonNode body) {
            Runnable hook = beforeNextPut;
            if (method == RequestMethod.PUT && hook != null) {
                beforeNextPut = null;
                hook.run();
            }
            return delegate.submit(path, method, body);
        }

        @Override
        public String name() {
            return "intercepting";
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
