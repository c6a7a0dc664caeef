package com.docgate.gateway.table;

/** How a bulk write treats operations that fail validation. */
public enum BulkMode {
    /** Apply every valid operation; report the rest individually. */
    BEST_EFFORT,
    /** Write nothing if any operation fails validation. */
    ALL_OR_NOTHING
}
