package com.flagship.event_ledger.ingestion;

/**
 * Applies the domain mutation carried by one raw event. Runs inside the
 * processor's transaction: throwing rolls back the mutation and leaves the
 * event unprocessed.
 */
@FunctionalInterface
public interface EventMutationHandler {

    void apply(RawEvent event);
}
