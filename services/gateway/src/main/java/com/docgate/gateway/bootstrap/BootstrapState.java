package com.docgate.gateway.bootstrap;

/** Whether a subject can be served without first creating its documents. */
public enum BootstrapState {
    /** No user document yet, or one without an active tenant. */
    NEEDS_BOOTSTRAP,
    READY
}
