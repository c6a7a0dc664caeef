package com.docgate.model.error;

/**
 * Base class for every failure the gateway core reports to its caller.
 * <p>
 * Unchecked: callers either map the {@link #kind()} to a response or let it propagate.
 */
public abstract class GatewayException extends RuntimeException {

    private final ErrorKind kind;

    protected GatewayException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected GatewayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
