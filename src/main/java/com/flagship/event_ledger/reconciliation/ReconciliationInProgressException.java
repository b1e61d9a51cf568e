package com.flagship.event_ledger.reconciliation;

/**
 * A full reconciliation run is already in flight.
 */
public class ReconciliationInProgressException extends RuntimeException {

    public ReconciliationInProgressException() {
        super("A reconciliation run is already in progress");
    }
}
