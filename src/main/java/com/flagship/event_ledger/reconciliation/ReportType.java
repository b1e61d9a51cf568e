package com.flagship.event_ledger.reconciliation;

public enum ReportType {
    MANUAL,
    SCHEDULED,
    /** Negative-balance-only check run on the short cadence. */
    QUICK
}
