package com.docgate.model.error;

/**
 * A write lost a revision race, or a create hit an existing document or database.
 */
public class ConflictException extends GatewayException {

    private final String resource;

    public ConflictException(String resource) {
        this(resource, "Document update conflict");
    }

    public ConflictException(String resource, String detail) {
        super(ErrorKind.CONFLICT, "%s: %s".formatted(detail, resource));
        this.resource = resource;
    }

    public String resource() {
        return resource;
    }
}
