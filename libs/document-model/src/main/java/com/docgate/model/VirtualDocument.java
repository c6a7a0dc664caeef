package com.docgate.model;

import java.time.Instant;

/**
 * A document exposed through one of the virtual collections.
 * <p>
 * The set of variants is closed: every switch over a {@code VirtualDocument} is exhaustive,
 * so adding a collection is a compile error everywhere a decision depends on the kind.
 */
public sealed interface VirtualDocument permits UserDocument, TenantDocument {

    /** Internal, namespaced id ({@code user_...} or {@code tenant_...}). */
    String id();

    /** Current revision, or null for a document that has not been written yet. */
    String rev();

    DocumentKind kind();

    boolean deleted();

    Instant createdAt();

    Instant updatedAt();

    /** Returns a copy carrying the given revision. */
    VirtualDocument withRevision(String rev);
}
