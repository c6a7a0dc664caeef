package com.docgate.model.error;

import java.util.List;

/**
 * A write named one or more fields that cannot be changed. The whole write is rejected.
 */
public class ImmutableFieldException extends GatewayException {

    private final List<String> fields;

    public ImmutableFieldException(List<String> fields) {
        super(ErrorKind.IMMUTABLE_FIELD, "Immutable field(s): " + String.join(", ", fields));
        this.fields = List.copyOf(fields);
    }

    public List<String> fields() {
        return fields;
    }
}
