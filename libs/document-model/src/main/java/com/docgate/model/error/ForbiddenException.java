package com.docgate.model.error;

/**
 * The document exists but the requester may not perform the action on it.
 */
public class ForbiddenException extends GatewayException {

    private final String action;
    private final String resource;

    public ForbiddenException(String action, String resource) {
        this(action, resource, null);
    }

    public ForbiddenException(String action, String resource, String reason) {
        super(ErrorKind.FORBIDDEN, reason == null
                ? "Forbidden: cannot %s %s".formatted(action, resource)
                : "Forbidden: cannot %s %s (%s)".formatted(action, resource, reason));
        this.action = action;
        this.resource = resource;
    }

    public String action() {
        return action;
    }

    public String resource() {
        return resource;
    }
}
