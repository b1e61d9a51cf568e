package com.flagship.event_ledger.reconciliation;

public enum ReportStatus {
    RUNNING,
    COMPLETED,
    /** At least one rule threw; findings of the remaining rules are still reported. */
    FAILED
}
