package com.docgate.model.error;

/**
 * The request body or path is not something the gateway or the backend understands.
 */
public class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }
}
