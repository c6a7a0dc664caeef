package com.docgate.storage.memory;

import com.docgate.model.ChangeRecord;
import com.docgate.model.DocumentCodec;
import com.docgate.model.error.ConflictException;
import com.docgate.model.error.DocumentNotFoundException;
import com.docgate.model.error.GatewayException;
import com.docgate.model.error.InvalidRequestException;
import com.docgate.storage.BackendPath;
import com.docgate.storage.RequestMethod;
import com.docgate.storage.StorageBackend;
import com.docgate.storage.query.SelectorMatcher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * Deterministic in-process emulation of a CouchDB-compatible document store.
 * <p>
 * Follows the same revision rules as the real server: creating requires no revision, updating
 * and deleting require the current one, anything else is a {@link ConflictException}. Every
 * document write appends to the change log and bumps the database sequence; {@code _local}
 * checkpoints do neither.
 * <p>
 * A single {@link ReentrantReadWriteLock} guards all databases. Writers are exclusive, and the
 * change feed filters the log while holding the read lock, so a reader never observes a
 * sequence without its change.
 */
public final class MemoryBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(MemoryBackend.class);

    private static final ObjectMapper MAPPER = DocumentCodec.objectMapper();
    private static final Pattern DATABASE_NAME = Pattern.compile("[a-z][a-z0-9_$()+/-]*");
    private static final int DEFAULT_FIND_LIMIT = 25;

    private final Map<String, MemoryDatabase> databases = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Duration defaultTimeout;

    public MemoryBackend() {
        this(DEFAULT_TIMEOUT);
    }

    public MemoryBackend(Duration defaultTimeout) {
        if (defaultTimeout == null || defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public CompletableFuture<JsonNode> submit(String path, RequestMethod method, JsonNode body) {
        try {
            return CompletableFuture.completedFuture(handle(BackendPath.parse(path), method, body));
        } catch (RuntimeException e) {
            log.debug("{} {} failed: {}", method, path, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    @Override
    public void close() {
        log.debug("Memory backend closed with {} database(s)", databaseCount());
    }

    /** Number of databases currently held. */
    public int databaseCount() {
        Lock read = lock.readLock();
        read.lock();
        try {
            return databases.size();
        } finally {
            read.unlock();
        }
    }

    private JsonNode handle(BackendPath path, RequestMethod method, JsonNode body) {
        Lock guard = isReadOnly(path, method) ? lock.readLock() : lock.writeLock();
        guard.lock();
        try {
            return dispatch(path, method, body);
        } finally {
            guard.unlock();
        }
    }

    private static boolean isReadOnly(BackendPath path, RequestMethod method) {
        List<String> segments = path.segments();
        return method == RequestMethod.GET
                || (method == RequestMethod.POST && segments.size() == 2 && BackendPath.FIND.equals(segments.get(1)));
    }

    private JsonNode dispatch(BackendPath path, RequestMethod method, JsonNode body) {
        List<String> segments = path.segments();
        if (segments.isEmpty()) {
            requireMethod(path, method, RequestMethod.GET);
            return serverInfo();
        }
        String db = segments.get(0);
        if (segments.size() == 1) {
            return databaseRequest(db, method, body);
        }
        String second = segments.get(1);
        if (BackendPath.LOCAL.equals(second)) {
            if (segments.size() != 3) {
                throw unsupported(path, method);
            }
            return localRequest(requireDatabase(db), segments.get(2), method, body);
        }
        if (segments.size() != 2) {
            throw unsupported(path, method);
        }
        return switch (second) {
            case BackendPath.BULK_DOCS -> {
                requireMethod(path, method, RequestMethod.POST);
                yield bulkDocs(requireDatabase(db), body);
            }
            case BackendPath.FIND -> {
                requireMethod(path, method, RequestMethod.POST);
                yield find(requireDatabase(db), body);
            }
            case BackendPath.CHANGES -> {
                requireMethod(path, method, RequestMethod.GET);
                yield changes(requireDatabase(db), path);
            }
            case BackendPath.ALL_DOCS -> {
                requireMethod(path, method, RequestMethod.GET);
                yield allDocs(requireDatabase(db), path);
            }
            default -> {
                if (second.startsWith("_")) {
                    throw unsupported(path, method);
                }
                yield documentRequest(requireDatabase(db), second, method, body, path);
            }
        };
    }

    private static JsonNode serverInfo() {
        ObjectNode info = MAPPER.createObjectNode();
        info.put("couchdb", "Welcome");
        info.put("version", "memory");
        info.putObject("vendor").put("name", "docgate");
        return info;
    }

    // ---- databases ----

    private JsonNode databaseRequest(String db, RequestMethod method, JsonNode body) {
        switch (method) {
            case GET -> {
                MemoryDatabase database = requireDatabase(db);
                ObjectNode info = MAPPER.createObjectNode();
                info.put("db_name", database.name());
                info.put("doc_count", database.liveCount());
                info.put("doc_del_count", database.tombstoneCount());
                info.put("update_seq", database.seq());
                return info;
            }
            case PUT -> {
                if (!DATABASE_NAME.matcher(db).matches()) {
                    throw new InvalidRequestException("Illegal database name: " + db);
                }
                if (databases.containsKey(db)) {
                    throw new ConflictException("/" + db, "The database could not be created, the file already exists");
                }
                databases.put(db, new MemoryDatabase(db));
                log.info("Created database {}", db);
                return ok();
            }
            case DELETE -> {
                if (databases.remove(db) == null) {
                    throw new DocumentNotFoundException("/" + db);
                }
                log.info("Deleted database {}", db);
                return ok();
            }
            case POST -> {
                MemoryDatabase database = requireDatabase(db);
                ObjectNode document = requireObject(body);
                String docId = document.hasNonNull("_id") ? document.get("_id").asText() : newDocId();
                String rev = write(database, docId, document, textOrNull(document, "_rev"));
                return writeResult(docId, rev);
            }
            default -> throw new InvalidRequestException("Unsupported method " + method);
        }
    }

    private MemoryDatabase requireDatabase(String db) {
        MemoryDatabase database = databases.get(db);
        if (database == null) {
            throw new DocumentNotFoundException("/" + db);
        }
        return database;
    }

    // ---- documents ----

    private JsonNode documentRequest(MemoryDatabase db, String docId, RequestMethod method,
                                     JsonNode body, BackendPath path) {
        switch (method) {
            case GET -> {
                ObjectNode document = db.documents().get(docId);
                if (document == null || MemoryDatabase.isTombstone(document)) {
                    throw new DocumentNotFoundException("/" + db.name() + "/" + docId);
                }
                return document.deepCopy();
            }
            case PUT -> {
                ObjectNode document = requireObject(body);
                String expectedRev = path.param("rev").orElse(textOrNull(document, "_rev"));
                String rev = write(db, docId, document, expectedRev);
                return writeResult(docId, rev);
            }
            case DELETE -> {
                String expectedRev = path.param("rev")
                        .orElse(body != null ? textOrNull(body, "_rev") : null);
                String rev = write(db, docId, tombstoneBody(), expectedRev);
                return writeResult(docId, rev);
            }
            default -> throw unsupported(path, method);
        }
    }

    /**
     * Applies one write under the revision rules and returns the new revision.
     */
    private String write(MemoryDatabase db, String docId, JsonNode body, String expectedRev) {
        String resource = "/" + db.name() + "/" + docId;
        ObjectNode existing = db.documents().get(docId);
        String currentRev = existing == null ? null : textOrNull(existing, "_rev");
        boolean absent = existing == null || MemoryDatabase.isTombstone(existing);
        boolean deleting = body.path("_deleted").asBoolean(false);

        if (absent) {
            if (deleting) {
                throw new DocumentNotFoundException(resource);
            }
            if (expectedRev != null && !(existing != null && expectedRev.equals(currentRev))) {
                throw new ConflictException(resource);
            }
        } else if (!Objects.equals(expectedRev, currentRev)) {
            throw new ConflictException(resource);
        }

        ObjectNode content = MAPPER.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!"_id".equals(field.getKey()) && !"_rev".equals(field.getKey())) {
                content.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        String rev = Revisions.next(currentRev, content);

        ObjectNode stored = MAPPER.createObjectNode();
        stored.put("_id", docId);
        stored.put("_rev", rev);
        stored.setAll(content);
        db.documents().put(docId, stored);
        ChangeRecord change = db.record(docId, rev, deleting);
        log.debug("{} {} rev {} seq {}", deleting ? "Deleted" : "Wrote", resource, rev, change.seq());
        return rev;
    }

    private JsonNode bulkDocs(MemoryDatabase db, JsonNode body) {
        JsonNode docs = requireObject(body).path("docs");
        if (!docs.isArray()) {
            throw new InvalidRequestException("_bulk_docs body must contain a docs array");
        }
        ArrayNode results = MAPPER.createArrayNode();
        for (JsonNode doc : docs) {
            if (!doc.isObject()) {
                ObjectNode error = results.addObject();
                error.put("error", "bad_request");
                error.put("reason", "Document must be a JSON object");
                continue;
            }
            String docId = doc.hasNonNull("_id") ? doc.get("_id").asText() : newDocId();
            try {
                String rev = write(db, docId, doc, textOrNull(doc, "_rev"));
                ObjectNode ok = results.addObject();
                ok.put("ok", true);
                ok.put("id", docId);
                ok.put("rev", rev);
            } catch (GatewayException e) {
                ObjectNode error = results.addObject();
                error.put("id", docId);
                error.put("error", e.kind().code());
                error.put("reason", e.getMessage());
            }
        }
        return results;
    }

    // ---- queries ----

    private JsonNode find(MemoryDatabase db, JsonNode body) {
        ObjectNode request = requireObject(body);
        JsonNode selector = request.path("selector");
        if (!selector.isObject()) {
            throw new InvalidRequestException("_find requires a selector object");
        }
        int limit = request.path("limit").asInt(DEFAULT_FIND_LIMIT);
        int skip = request.path("skip").asInt(0);

        List<ObjectNode> matches = new ArrayList<>();
        for (ObjectNode document : db.documents().values()) {
            if (!MemoryDatabase.isTombstone(document) && SelectorMatcher.matches(document, selector)) {
                matches.add(document);
            }
        }
        Comparator<JsonNode> order = sortOrder(request.path("sort"));
        if (order != null) {
            matches.sort(order);
        }

        ObjectNode result = MAPPER.createObjectNode();
        ArrayNode out = result.putArray("docs");
        matches.stream()
                .skip(skip)
                .limit(limit)
                .forEach(document -> out.add(project(document, request.path("fields"))));
        return result;
    }

    private static Comparator<JsonNode> sortOrder(JsonNode sort) {
        if (!sort.isArray() || sort.isEmpty()) {
            return null;
        }
        Comparator<JsonNode> order = null;
        for (JsonNode spec : sort) {
            String field;
            boolean descending = false;
            if (spec.isTextual()) {
                field = spec.textValue();
            } else if (spec.isObject() && spec.size() == 1) {
                field = spec.fieldNames().next();
                descending = "desc".equalsIgnoreCase(spec.get(field).asText());
            } else {
                throw new InvalidRequestException("Invalid sort entry: " + spec);
            }
            Comparator<JsonNode> byField = Comparator.comparing(
                    document -> document.path(field).asText(""), Comparator.naturalOrder());
            if (descending) {
                byField = byField.reversed();
            }
            order = order == null ? byField : order.thenComparing(byField);
        }
        return order;
    }

    private static JsonNode project(ObjectNode document, JsonNode fields) {
        if (!fields.isArray() || fields.isEmpty()) {
            return document.deepCopy();
        }
        ObjectNode projected = MAPPER.createObjectNode();
        for (JsonNode field : fields) {
            JsonNode value = document.get(field.asText());
            if (value != null) {
                projected.set(field.asText(), value.deepCopy());
            }
        }
        return projected;
    }

    private JsonNode changes(MemoryDatabase db, BackendPath path) {
        long since = "now".equals(path.param("since").orElse(null))
                ? db.seq()
                : path.longParam("since").orElse(0L);
        Long limit = path.longParam("limit").orElse(null);
        boolean includeDocs = path.flag("include_docs");

        // newest change per document, collected newest-first then reversed
        Deque<ChangeRecord> latest = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        List<ChangeRecord> changeLog = db.changeLog();
        for (int i = changeLog.size() - 1; i >= 0 && changeLog.get(i).seq() > since; i--) {
            ChangeRecord change = changeLog.get(i);
            if (seen.add(change.docId())) {
                latest.addFirst(change);
            }
        }

        ObjectNode result = MAPPER.createObjectNode();
        ArrayNode results = result.putArray("results");
        long lastSeq = Math.max(since, db.seq());
        int emitted = 0;
        for (ChangeRecord change : latest) {
            if (limit != null && emitted >= limit) {
                break;
            }
            ObjectNode entry = results.addObject();
            entry.put("seq", change.seq());
            entry.put("id", change.docId());
            entry.putArray("changes").addObject().put("rev", change.rev());
            if (change.deleted()) {
                entry.put("deleted", true);
            }
            if (includeDocs) {
                entry.set("doc", db.documents().get(change.docId()).deepCopy());
            }
            emitted++;
        }
        long pending = latest.size() - emitted;
        if (pending > 0) {
            lastSeq = results.get(results.size() - 1).get("seq").asLong();
        }
        result.put("last_seq", lastSeq);
        result.put("pending", pending);
        return result;
    }

    private JsonNode allDocs(MemoryDatabase db, BackendPath path) {
        boolean includeDocs = path.flag("include_docs");
        long limit = path.longParam("limit").orElse(Long.MAX_VALUE);
        ObjectNode result = MAPPER.createObjectNode();
        result.put("total_rows", db.liveCount());
        result.put("offset", 0);
        ArrayNode rows = result.putArray("rows");
        db.documents().values().stream()
                .filter(document -> !MemoryDatabase.isTombstone(document))
                .limit(limit)
                .forEach(document -> {
                    ObjectNode row = rows.addObject();
                    String id = document.get("_id").asText();
                    row.put("id", id);
                    row.put("key", id);
                    row.putObject("value").put("rev", document.get("_rev").asText());
                    if (includeDocs) {
                        row.set("doc", document.deepCopy());
                    }
                });
        return result;
    }

    // ---- local checkpoints ----

    private JsonNode localRequest(MemoryDatabase db, String localId, RequestMethod method, JsonNode body) {
        String fullId = BackendPath.LOCAL + "/" + localId;
        switch (method) {
            case GET -> {
                ObjectNode document = db.localDocuments().get(localId);
                if (document == null) {
                    throw new DocumentNotFoundException("/" + db.name() + "/" + fullId);
                }
                return document.deepCopy();
            }
            case PUT -> {
                ObjectNode document = requireObject(body).deepCopy();
                String rev = db.nextLocalRevision();
                document.put("_id", fullId);
                document.put("_rev", rev);
                db.localDocuments().put(localId, document);
                return writeResult(fullId, rev);
            }
            case DELETE -> {
                if (db.localDocuments().remove(localId) == null) {
                    throw new DocumentNotFoundException("/" + db.name() + "/" + fullId);
                }
                return writeResult(fullId, "0-0");
            }
            default -> throw new InvalidRequestException("Unsupported method " + method + " for " + fullId);
        }
    }

    // ---- helpers ----

    private static ObjectNode tombstoneBody() {
        ObjectNode tombstone = MAPPER.createObjectNode();
        tombstone.put("_deleted", true);
        return tombstone;
    }

    private static ObjectNode ok() {
        return MAPPER.createObjectNode().put("ok", true);
    }

    private static ObjectNode writeResult(String id, String rev) {
        ObjectNode result = ok();
        result.put("id", id);
        result.put("rev", rev);
        return result;
    }

    private static ObjectNode requireObject(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new InvalidRequestException("Request body must be a JSON object");
        }
        return (ObjectNode) body;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String newDocId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static void requireMethod(BackendPath path, RequestMethod actual, RequestMethod expected) {
        if (actual != expected) {
            throw unsupported(path, actual);
        }
    }

    private static InvalidRequestException unsupported(BackendPath path, RequestMethod method) {
        return new InvalidRequestException("Unsupported endpoint: %s /%s"
                .formatted(method, String.join("/", path.segments())));
    }
}
