package com.docgate.model.error;

/**
 * Failure categories surfaced by the gateway core.
 * <p>
 * Each kind carries the HTTP status and error code the calling HTTP layer maps it to, so the
 * mapping lives next to the kind instead of in every adapter.
 */
public enum ErrorKind {
    NOT_FOUND("not_found", 404),
    FORBIDDEN("forbidden", 403),
    IMMUTABLE_FIELD("immutable_field", 400),
    CONFLICT("conflict", 409),
    MALFORMED_IDENTIFIER("malformed_identifier", 400),
    BACKEND_UNAVAILABLE("backend_unavailable", 503),
    INVALID_REQUEST("bad_request", 400);

    private final String code;
    private final int httpStatus;

    ErrorKind(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
