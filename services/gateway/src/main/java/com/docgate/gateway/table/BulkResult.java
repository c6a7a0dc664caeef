package com.docgate.gateway.table;

import com.docgate.model.error.ErrorKind;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one operation of a bulk write, in the caller's id space.
 *
 * @param id external id of the document (null when the operation had none and failed early)
 * @param ok whether the operation was written
 * @param rev new revision when written
 * @param error failure kind when not written
 * @param reason failure detail when not written
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BulkResult(String id, boolean ok, String rev, ErrorKind error, String reason) {

    public static BulkResult written(String id, String rev) {
        return new BulkResult(id, true, rev, null, null);
    }

    public static BulkResult failed(String id, ErrorKind error, String reason) {
        return new BulkResult(id, false, null, error, reason);
    }
}
