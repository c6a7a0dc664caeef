package com.docgate.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.docgate.model.IdentifierMapper;
import com.docgate.model.TenantDocument;
import com.docgate.model.TenantPatch;
import com.docgate.model.UserDocument;
import com.docgate.model.VirtualDocument;
import com.docgate.model.error.ConflictException;
import com.docgate.model.error.DocumentNotFoundException;
import com.docgate.model.error.ErrorKind;
import com.docgate.storage.memory.MemoryBackend;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DocumentStore")
class DocumentStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private MemoryBackend backend;
    private DocumentStore store;

    @BeforeEach
    void setUp() {
        backend = new MemoryBackend();
        store = new DocumentStore(backend, "docs");
        store.ensureDatabase();
    }

    @Test
    @DisplayName("ensureDatabase is idempotent")
    void ensureDatabaseTwice() {
        store.ensureDatabase();
        assertThat(backend.databaseCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("create then find returns the stored document with its revision")
    void createAndFind() {
        UserDocument created = store.create(UserDocument.forSubject("ext_42", "Ext", null, NOW));

        assertThat(created.rev()).startsWith("1-");
        assertThat(store.find(created.id(), UserDocument.class)).contains(created);
        assertThat(store.find(created.id(), TenantDocument.class)).isEmpty();
        assertThat(store.find("user_missing")).isEmpty();
    }

    @Test
    @DisplayName("require fails for a missing or differently typed document")
    void require() {
        UserDocument created = store.create(UserDocument.forSubject("ext_42", "Ext", null, NOW));

        assertThat(store.require(created.id(), UserDocument.class)).isEqualTo(created);
        assertThatThrownBy(() -> store.require(created.id(), TenantDocument.class))
                .isInstanceOf(DocumentNotFoundException.class);
        assertThatThrownBy(() -> store.require("user_missing", UserDocument.class))
                .isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    @DisplayName("create is create-if-absent")
    void createIfAbsent() {
        store.create(UserDocument.forSubject("ext_42", "Ext", null, NOW));
        assertThatThrownBy(() -> store.create(UserDocument.forSubject("ext_42", "Other", null, NOW)))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("put with a stale revision conflicts")
    void staleRevision() {
        UserDocument created = store.create(UserDocument.forSubject("ext_42", "Ext", null, NOW));
        store.put(created.withActiveTenant("tenant_a", NOW));

        assertThatThrownBy(() -> store.put(created.withActiveTenant("tenant_b", NOW)))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("put returns the written document with its new revision, typed as given")
    void putKeepsVariant() {
        TenantDocument tenant = store.create(
                TenantDocument.ownedBy("tenant_a", IdentifierMapper.userIdForSubject("a"), "A", null, false, NOW));
        VirtualDocument renamed = tenant.apply(new TenantPatch(tenant.rev(), "B", null), NOW);

        VirtualDocument written = store.put(renamed);

        assertThat(written).isInstanceOfSatisfying(TenantDocument.class, doc -> {
            assertThat(doc.rev()).startsWith("2-");
            assertThat(doc.name()).isEqualTo("B");
        });
        assertThat(store.require("tenant_a", TenantDocument.class)).isEqualTo(written);
    }

    @Test
    @DisplayName("bulkPut reports each document separately")
    void bulkPut() {
        UserDocument existing = store.create(UserDocument.forSubject("a", null, null, NOW));
        List<VirtualDocument> batch = List.of(
                UserDocument.forSubject("b", null, null, NOW),
                UserDocument.forSubject("a", null, null, NOW),
                existing.withActiveTenant("tenant_x", NOW));

        List<BulkWriteResult> results = store.bulkPut(batch);

        assertThat(results).extracting(BulkWriteResult::ok).containsExactly(true, false, true);
        assertThat(results.get(1).error()).isEqualTo(ErrorKind.CONFLICT);
        assertThat(results.get(2).rev()).startsWith("2-");
    }

    @Test
    @DisplayName("query returns matching documents of the requested variant")
    void query() {
        String owner = IdentifierMapper.userIdForSubject("owner");
        store.create(TenantDocument.ownedBy("tenant_a", owner, "A", null, false, NOW));
        store.create(TenantDocument.ownedBy("tenant_b", IdentifierMapper.userIdForSubject("x"), "B", null, false, NOW));
        store.create(UserDocument.forSubject("owner", null, null, NOW));

        ObjectNode selector = JsonNodeFactory.instance.objectNode();
        selector.put("type", "tenant");
        selector.putObject("memberIds").putArray("$all").add(owner);

        assertThat(store.query(selector, TenantDocument.class))
                .extracting(TenantDocument::id)
                .containsExactly("tenant_a");
    }

    @Test
    @DisplayName("changes decode documents and advance the cursor")
    void changes() {
        UserDocument user = store.create(UserDocument.forSubject("a", null, null, NOW));

        ChangesFeed feed = store.changes("0", null);

        assertThat(feed.changes()).hasSize(1);
        assertThat(feed.changes().get(0).record().docId()).isEqualTo(user.id());
        assertThat(feed.changes().get(0).document()).isEqualTo(user);
        assertThat(store.changes(feed.lastSeq(), null).changes()).isEmpty();
    }

    @Test
    @DisplayName("opaque sequence strings order by their numeric prefix")
    void parseSeq() {
        assertThat(DocumentStore.parseSeq(JsonNodeFactory.instance.textNode("12-g1AAAA"))).isEqualTo(12);
        assertThat(DocumentStore.parseSeq(JsonNodeFactory.instance.numberNode(7))).isEqualTo(7);
        assertThat(DocumentStore.parseSeq(JsonNodeFactory.instance.textNode("now"))).isZero();
    }
}
