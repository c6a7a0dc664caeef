package com.docgate.model.error;

/**
 * An id does not have the shape of its namespace.
 */
public class MalformedIdentifierException extends GatewayException {

    private final String identifier;

    public MalformedIdentifierException(String identifier, String reason) {
        super(ErrorKind.MALFORMED_IDENTIFIER, "Malformed identifier '%s': %s".formatted(identifier, reason));
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
