package com.flagship.event_ledger.wagering;

public enum BetStatus {
    OPEN,
    WON,
    LOST,
    VOID
}
