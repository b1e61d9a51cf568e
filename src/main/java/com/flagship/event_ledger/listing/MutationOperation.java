package com.flagship.event_ledger.listing;

/**
 * Kind of change recorded in the listing version log.
 * BULK_CREATE behaves like CREATE but marks items that arrived in a batch.
 */
public enum MutationOperation {
    CREATE,
    UPDATE,
    DELETE,
    BULK_CREATE;

    public boolean isCreate() {
        return this == CREATE || this == BULK_CREATE;
    }
}
