package com.docgate.storage;

/** HTTP verbs understood by the document-store contract. */
public enum RequestMethod {
    GET,
    PUT,
    POST,
    DELETE;

    /** True for verbs that carry a request body. */
    public boolean hasBody() {
        return this == PUT || this == POST;
    }
}
