package com.flagship.event_ledger.ledger;

public enum EntryType {
    DEBIT,
    CREDIT
}
