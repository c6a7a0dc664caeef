package com.docgate.storage;

import com.docgate.model.error.ErrorKind;

/**
 * Outcome of one document in a {@code _bulk_docs} call.
 *
 * @param id     internal document id
 * @param ok     true when the document was written
 * @param rev    new revision when ok, otherwise null
 * @param error  failure kind when not ok, otherwise null
 * @param reason backend-supplied detail when not ok
 */
public record BulkWriteResult(String id, boolean ok, String rev, ErrorKind error, String reason) {

    public static BulkWriteResult written(String id, String rev) {
        return new BulkWriteResult(id, true, rev, null, null);
    }

    public static BulkWriteResult failed(String id, ErrorKind error, String reason) {
        return new BulkWriteResult(id, false, null, error, reason);
    }
}
