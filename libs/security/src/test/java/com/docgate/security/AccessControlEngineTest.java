package com.docgate.security;

import com.docgate.model.IdentifierMapper;
import com.docgate.model.TenantDocument;
import com.docgate.model.UserDocument;
import com.docgate.model.error.ForbiddenException;
import com.docgate.security.testing.TestClaimsFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AccessControlEngine")
class AccessControlEngineTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final Requester alice = TestClaimsFactory.requester("alice");
    private final Requester bob = TestClaimsFactory.requester("bob");
    private final Requester admin = TestClaimsFactory.adminRequester("carol");

    private final UserDocument aliceDoc = UserDocument.forSubject("alice", "Alice", "alice@example.com", NOW);
    private final UserDocument bobDoc = UserDocument.forSubject("bob", "Bob", "bob@example.com", NOW);

    private final TenantDocument shared = TenantDocument
            .ownedBy("tenant_shared", alice.userId(), "Shared", Map.of(), false, NOW)
            .withMember(bob.userId(), NOW);

    @Nested
    @DisplayName("users")
    class Users {

        @Test
        @DisplayName("a subject reads and updates its own document")
        void self() {
            assertThat(AccessControlEngine.canRead(alice, aliceDoc)).isTrue();
            assertThat(AccessControlEngine.canUpdate(alice, aliceDoc)).isTrue();
        }

        @Test
        @DisplayName("a subject cannot read or update someone else")
        void others() {
            assertThat(AccessControlEngine.canRead(alice, bobDoc)).isFalse();
            assertThat(AccessControlEngine.canUpdate(alice, bobDoc)).isFalse();
        }

        @Test
        @DisplayName("nobody deletes themselves, not even an administrator")
        void neverSelfDelete() {
            UserDocument carol = UserDocument.forSubject("carol", null, null, NOW);
            assertThat(AccessControlEngine.canDelete(alice, aliceDoc, null)).isFalse();
            assertThat(AccessControlEngine.canDelete(admin, carol, null)).isFalse();
        }

        @Test
        @DisplayName("deleting another user requires the administrator role")
        void adminDeletesOthers() {
            assertThat(AccessControlEngine.canDelete(alice, bobDoc, null)).isFalse();
            assertThat(AccessControlEngine.canDelete(admin, bobDoc, null)).isTrue();
        }

        @Test
        @DisplayName("requireDelete explains a self delete")
        void selfDeleteReason() {
            assertThatThrownBy(() -> AccessControlEngine.requireDelete(alice, aliceDoc, null))
                    .isInstanceOf(ForbiddenException.class)
                    .hasMessageContaining("users cannot delete themselves")
                    .hasMessageContaining(IdentifierMapper.externalIdForSubject("alice"));
        }
    }

    @Nested
    @DisplayName("tenants")
    class Tenants {

        @Test
        @DisplayName("members read, outsiders do not")
        void read() {
            assertThat(AccessControlEngine.canRead(bob, shared)).isTrue();
            assertThat(AccessControlEngine.canRead(admin, shared)).isFalse();
        }

        @Test
        @DisplayName("only the owner updates")
        void update() {
            assertThat(AccessControlEngine.canUpdate(alice, shared)).isTrue();
            assertThat(AccessControlEngine.canUpdate(bob, shared)).isFalse();
            assertThatThrownBy(() -> AccessControlEngine.requireUpdate(bob, shared))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("the owner deletes unless it is the active tenant")
        void delete() {
            assertThat(AccessControlEngine.canDelete(alice, shared, "tenant_other")).isTrue();
            assertThat(AccessControlEngine.canDelete(alice, shared, "tenant_shared")).isFalse();
            assertThat(AccessControlEngine.canDelete(bob, shared, "tenant_other")).isFalse();
        }

        @Test
        @DisplayName("requireDelete names the active tenant as the reason")
        void activeTenantReason() {
            assertThatThrownBy(() -> AccessControlEngine.requireDelete(alice, shared, "tenant_shared"))
                    .isInstanceOf(ForbiddenException.class)
                    .hasMessageContaining("active tenant");
        }

        @Test
        @DisplayName("members may leave, the owner removes others, nobody removes the owner")
        void removeMember() {
            assertThat(AccessControlEngine.canRemoveMember(bob, shared, bob.userId())).isTrue();
            assertThat(AccessControlEngine.canRemoveMember(alice, shared, bob.userId())).isTrue();
            assertThat(AccessControlEngine.canRemoveMember(alice, shared, alice.userId())).isFalse();
            assertThat(AccessControlEngine.canRemoveMember(bob, shared, alice.userId())).isFalse();
        }

        @Test
        @DisplayName("personal tenants are never deleted and never gain members")
        void personal() {
            TenantDocument personal = TenantDocument.ownedBy("tenant_personal", alice.userId(), "Alice's Workspace",
                    Map.of("autoCreated", true), true, NOW);

            assertThat(AccessControlEngine.canDelete(alice, personal, "tenant_other")).isFalse();
            assertThat(AccessControlEngine.canAddMember(alice, personal)).isFalse();
            assertThatThrownBy(() -> AccessControlEngine.requireDelete(alice, personal, "tenant_other"))
                    .hasMessageContaining("personal tenants cannot be deleted");
        }

        @Test
        @DisplayName("only the owner adds members")
        void addMember() {
            assertThat(AccessControlEngine.canAddMember(alice, shared)).isTrue();
            assertThat(AccessControlEngine.canAddMember(bob, shared)).isFalse();
        }
    }
}
