package com.docgate.storage;

import com.docgate.model.ChangeRecord;
import com.docgate.model.VirtualDocument;

import java.util.List;

/**
 * One page of a database change feed.
 *
 * @param changes changes in ascending sequence order
 * @param lastSeq opaque cursor to pass back as {@code since} for the next page
 * @param pending number of further changes the backend reported beyond this page
 */
public record ChangesFeed(List<Change> changes, String lastSeq, long pending) {

    public ChangesFeed {
        changes = List.copyOf(changes);
    }

    /**
     * A change together with the document as of that change; the document is null when the
     * backend no longer holds a body for it.
     */
    public record Change(ChangeRecord record, VirtualDocument document) {
    }
}
