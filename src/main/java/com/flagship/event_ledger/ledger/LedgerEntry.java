package com.flagship.event_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class LedgerEntry {
    UUID id;
    UUID transactionId;
    UUID accountId;
    BigDecimal amount;
    EntryType entryType;
    String description;
    Long sequenceNumber;
}
