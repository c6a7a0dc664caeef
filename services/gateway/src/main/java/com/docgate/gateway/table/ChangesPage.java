package com.docgate.gateway.table;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Changes of one virtual table visible to the requester.
 *
 * @param results visible changes, ascending by sequence
 * @param lastSeq opaque cursor for the next call; covers hidden changes too
 */
public record ChangesPage(List<Entry> results, String lastSeq) {

    public ChangesPage {
        results = List.copyOf(results);
    }

    /**
     * @param seq change sequence
     * @param id external document id
     * @param rev revision after the change
     * @param doc document view after the change
     */
    public record Entry(long seq, String id, String rev, ObjectNode doc) {}
}
