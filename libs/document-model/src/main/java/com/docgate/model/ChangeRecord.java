package com.docgate.model;

/**
 * One entry of a database change feed.
 *
 * @param seq     sequence number, strictly increasing within a database
 * @param docId   internal id of the changed document
 * @param deleted true when the change removed the document from the store
 * @param rev     revision produced by the change
 */
public record ChangeRecord(long seq, String docId, boolean deleted, String rev) {

    public ChangeRecord {
        if (seq <= 0) {
            throw new IllegalArgumentException("seq must be positive");
        }
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId must not be null or blank");
        }
    }
}
