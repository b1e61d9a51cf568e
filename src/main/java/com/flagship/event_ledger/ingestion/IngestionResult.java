package com.flagship.event_ledger.ingestion;

/**
 * Outcome of handing one raw event to the processor.
 */
public enum IngestionResult {
    /** Mutation applied and event marked processed. */
    APPLIED,
    /** Event was already processed; nothing done. */
    DUPLICATE,
    /** No mutation is registered for the type; event marked processed. */
    SKIPPED,
    /** Mutation failed; event stays unprocessed for the reprocessing sweep. */
    FAILED
}
