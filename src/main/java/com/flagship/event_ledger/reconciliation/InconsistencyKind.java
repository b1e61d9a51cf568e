package com.flagship.event_ledger.reconciliation;

public enum InconsistencyKind {
    NEGATIVE_BALANCE,
    ORPHANED_BET,
    MISMATCHED_SETTLEMENT,
    STUCK_SETTLEMENT
}
