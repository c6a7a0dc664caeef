package com.docgate.model.error;

/**
 * The storage backend could not be reached, timed out, or rejected the gateway's credentials.
 */
public class BackendUnavailableException extends GatewayException {

    public BackendUnavailableException(String message) {
        super(ErrorKind.BACKEND_UNAVAILABLE, message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(ErrorKind.BACKEND_UNAVAILABLE, message, cause);
    }
}
