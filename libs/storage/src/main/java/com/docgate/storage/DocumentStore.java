package com.docgate.storage;

import com.docgate.model.ChangeRecord;
import com.docgate.model.DocumentCodec;
import com.docgate.model.DocumentKind;
import com.docgate.model.TenantDocument;
import com.docgate.model.UserDocument;
import com.docgate.model.VirtualDocument;
import com.docgate.model.error.BackendUnavailableException;
import com.docgate.model.error.ConflictException;
import com.docgate.model.error.DocumentNotFoundException;
import com.docgate.model.error.ErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Typed access to the virtual documents of one database.
 * <p>
 * Builds paths, encodes and decodes bodies through {@link DocumentCodec}, and turns the raw
 * backend answers into documents, revisions and per-item bulk results. Failures of the backend
 * propagate unchanged.
 */
public final class DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);
    private static final ObjectMapper MAPPER = DocumentCodec.objectMapper();

    public static final int DEFAULT_QUERY_LIMIT = 1000;

    private final StorageBackend backend;
    private final String database;
    private final int queryLimit;

    public DocumentStore(StorageBackend backend, String database) {
        this(backend, database, DEFAULT_QUERY_LIMIT);
    }

    public DocumentStore(StorageBackend backend, String database, int queryLimit) {
        if (backend == null) {
            throw new IllegalArgumentException("backend must not be null");
        }
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("database must not be null or blank");
        }
        if (queryLimit <= 0) {
            throw new IllegalArgumentException("queryLimit must be positive");
        }
        this.backend = backend;
        this.database = database;
        this.queryLimit = queryLimit;
    }

    /**
     * Creates the database unless it already exists.
     */
    public void ensureDatabase() {
        try {
            backend.get(BackendPath.database(database), RequestMethod.GET, null);
        } catch (DocumentNotFoundException missing) {
            try {
                backend.get(BackendPath.database(database), RequestMethod.PUT, null);
                log.info("Created database {} on {} backend", database, backend.name());
            } catch (ConflictException raced) {
                log.debug("Database {} was created concurrently", database);
            }
        }
    }

    /**
     * Fetches a document, soft-deleted ones included. Empty when the backend has no such id.
     */
    public Optional<VirtualDocument> find(String id) {
        try {
            JsonNode json = backend.get(BackendPath.document(database, id), RequestMethod.GET, null);
            return Optional.of(DocumentCodec.fromJson(json));
        } catch (DocumentNotFoundException e) {
            return Optional.empty();
        }
    }

    public <T extends VirtualDocument> Optional<T> find(String id, Class<T> type) {
        return find(id).filter(type::isInstance).map(type::cast);
    }

    /**
     * Like {@link #find(String, Class)}, but a missing document is an error.
     *
     * @throws DocumentNotFoundException if no document of that type has the id
     */
    public <T extends VirtualDocument> T require(String id, Class<T> type) {
        return find(id, type).orElseThrow(() -> new DocumentNotFoundException(id));
    }

    /**
     * Writes a user document that must not exist yet.
     *
     * @throws ConflictException if a document with the same id exists
     */
    public UserDocument create(UserDocument document) {
        requireUnwritten(document);
        return put(document);
    }

    /**
     * Writes a tenant document that must not exist yet.
     *
     * @throws ConflictException if a document with the same id exists
     */
    public TenantDocument create(TenantDocument document) {
        requireUnwritten(document);
        return put(document);
    }

    /**
     * Writes a document under its current revision and returns it with the new one.
     *
     * @throws ConflictException if the stored revision differs
     */
    public VirtualDocument put(VirtualDocument document) {
        return document.withRevision(write(document));
    }

    /** Typed variant of {@link #put(VirtualDocument)}. */
    public UserDocument put(UserDocument document) {
        return document.withRevision(write(document));
    }

    /** Typed variant of {@link #put(VirtualDocument)}. */
    public TenantDocument put(TenantDocument document) {
        return document.withRevision(write(document));
    }

    /**
     * Writes several documents in one call. Results are in input order; a failed item does not
     * affect the others.
     */
    public List<BulkWriteResult> bulkPut(List<? extends VirtualDocument> documents) {
        if (documents.isEmpty()) {
            return List.of();
        }
        ObjectNode body = MAPPER.createObjectNode();
        ArrayNode docs = body.putArray("docs");
        documents.forEach(document -> docs.add(DocumentCodec.toJson(document)));

        JsonNode response = backend.get(BackendPath.bulkDocs(database), RequestMethod.POST, body);
        if (!response.isArray() || response.size() != documents.size()) {
            throw new BackendUnavailableException("_bulk_docs answered %d result(s) for %d document(s)"
                    .formatted(response.size(), documents.size()));
        }
        List<BulkWriteResult> results = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            JsonNode item = response.get(i);
            String id = item.path("id").asText(documents.get(i).id());
            if (item.path("ok").asBoolean(false)) {
                results.add(BulkWriteResult.written(id, item.path("rev").asText()));
            } else {
                results.add(BulkWriteResult.failed(id, errorKind(item.path("error").asText()),
                        item.path("reason").asText(null)));
            }
        }
        return results;
    }

    /**
     * Runs a selector query and returns the matching documents of the given variant.
     */
    public <T extends VirtualDocument> List<T> query(ObjectNode selector, Class<T> type) {
        ObjectNode body = MAPPER.createObjectNode();
        body.set("selector", selector);
        body.put("limit", queryLimit);
        JsonNode response = backend.get(BackendPath.find(database), RequestMethod.POST, body);
        List<T> documents = new ArrayList<>();
        for (JsonNode json : response.path("docs")) {
            VirtualDocument document = DocumentCodec.fromJson(json);
            if (type.isInstance(document)) {
                documents.add(type.cast(document));
            }
        }
        return documents;
    }

    /**
     * Reads the change feed after {@code since}, with the current document bodies.
     *
     * @param since a cursor previously returned in {@link ChangesFeed#lastSeq()}, or {@code "0"}
     * @param limit maximum number of changes, or null for all
     */
    public ChangesFeed changes(String since, Integer limit) {
        JsonNode response = backend.get(BackendPath.changes(database, since, limit, true), RequestMethod.GET, null);
        List<ChangesFeed.Change> changes = new ArrayList<>();
        for (JsonNode item : response.path("results")) {
            String id = item.path("id").asText();
            if (id.startsWith("_design/")) {
                continue;
            }
            ChangeRecord record = new ChangeRecord(parseSeq(item.path("seq")), id,
                    item.path("deleted").asBoolean(false),
                    item.path("changes").path(0).path("rev").asText(null));
            changes.add(new ChangesFeed.Change(record, decodeIfVirtual(item.path("doc"))));
        }
        JsonNode lastSeq = response.path("last_seq");
        return new ChangesFeed(changes, lastSeq.isMissingNode() ? since : lastSeq.asText(), response.path("pending").asLong(0));
    }

    public String database() {
        return database;
    }

    public StorageBackend backend() {
        return backend;
    }

    /**
     * Numeric ordering key of a sequence value. Clustered servers send opaque strings such as
     * {@code 12-g1AAAA}; only the numeric prefix is kept, and it is never sent back as a cursor.
     */
    static long parseSeq(JsonNode seq) {
        if (seq.isNumber()) {
            return seq.asLong();
        }
        String text = seq.asText("");
        int end = 0;
        while (end < text.length() && Character.isDigit(text.charAt(end))) {
            end++;
        }
        return end == 0 ? 0 : Long.parseLong(text.substring(0, end));
    }

    private String write(VirtualDocument document) {
        JsonNode result = backend.get(BackendPath.document(database, document.id()), RequestMethod.PUT,
                DocumentCodec.toJson(document));
        return requireRev(result, document.id());
    }

    private static void requireUnwritten(VirtualDocument document) {
        if (document.rev() != null) {
            throw new IllegalArgumentException("create expects a document without revision: " + document.id());
        }
    }

    private static VirtualDocument decodeIfVirtual(JsonNode doc) {
        if (!doc.isObject() || doc.path("_deleted").asBoolean(false)) {
            return null;
        }
        if (DocumentKind.fromType(doc.path("type").asText(null)).isEmpty()) {
            return null;
        }
        return DocumentCodec.fromJson(doc);
    }

    private static String requireRev(JsonNode result, String id) {
        JsonNode rev = result.path("rev");
        if (!rev.isTextual()) {
            throw new BackendUnavailableException("Backend did not return a revision for " + id);
        }
        return rev.textValue();
    }

    private static ErrorKind errorKind(String code) {
        return switch (code) {
            case "conflict" -> ErrorKind.CONFLICT;
            case "not_found" -> ErrorKind.NOT_FOUND;
            case "forbidden", "unauthorized" -> ErrorKind.FORBIDDEN;
            case "bad_request" -> ErrorKind.INVALID_REQUEST;
            default -> ErrorKind.BACKEND_UNAVAILABLE;
        };
    }
}
