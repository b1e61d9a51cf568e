package com.flagship.event_ledger.ledger;

/**
 * Determines how a balance is derived from entries:
 * ASSET = debits - credits, LIABILITY and EQUITY = credits - debits.
 */
public enum AccountType {
    ASSET,
    LIABILITY,
    EQUITY;

    public boolean isDebitNormal() {
        return this == ASSET;
    }
}
