package com.flagship.event_ledger.wagering;

/**
 * Settlement lifecycle.
 *
 * Valid transitions:
 * - PENDING -> PROCESSING (submitted on chain)
 * - PENDING | PROCESSING -> COMPLETED (confirmed, ledger posted)
 * - PENDING | PROCESSING -> FAILED
 * - FAILED -> PENDING (a new request for the same bet)
 */
public enum SettlementStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
