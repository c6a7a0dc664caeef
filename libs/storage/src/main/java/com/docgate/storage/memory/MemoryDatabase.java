package com.docgate.storage.memory;

import com.docgate.model.ChangeRecord;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * State of one logical database. Not thread-safe; {@link MemoryBackend} guards every access.
 */
final class MemoryDatabase {

    private final String name;
    /** Current body of every document, tombstones included, ordered by id. */
    private final Map<String, ObjectNode> documents = new TreeMap<>();
    /** Checkpoints under {@code _local/}; never part of the change feed. */
    private final Map<String, ObjectNode> localDocuments = new HashMap<>();
    private final List<ChangeRecord> changeLog = new ArrayList<>();
    private long seq;
    private long localRevision;

    MemoryDatabase(String name) {
        this.name = name;
    }

    String name() {
        return name;
    }

    Map<String, ObjectNode> documents() {
        return documents;
    }

    Map<String, ObjectNode> localDocuments() {
        return localDocuments;
    }

    List<ChangeRecord> changeLog() {
        return changeLog;
    }

    long seq() {
        return seq;
    }

    /** Appends a change and bumps the sequence. */
    ChangeRecord record(String docId, String rev, boolean deleted) {
        seq++;
        ChangeRecord change = new ChangeRecord(seq, docId, deleted, rev);
        changeLog.add(change);
        return change;
    }

    String nextLocalRevision() {
        localRevision++;
        return "0-" + localRevision;
    }

    static boolean isTombstone(ObjectNode document) {
        return document != null && document.path("_deleted").asBoolean(false);
    }

    long liveCount() {
        return documents.values().stream().filter(d -> !isTombstone(d)).count();
    }

    long tombstoneCount() {
        return documents.size() - liveCount();
    }
}
