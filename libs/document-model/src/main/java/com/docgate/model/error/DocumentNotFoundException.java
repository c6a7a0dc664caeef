package com.docgate.model.error;

/**
 * The requested document or database does not exist, or is soft-deleted.
 */
public class DocumentNotFoundException extends GatewayException {

    private final String resource;

    public DocumentNotFoundException(String resource) {
        super(ErrorKind.NOT_FOUND, "Not found: " + resource);
        this.resource = resource;
    }

    public String resource() {
        return resource;
    }
}
