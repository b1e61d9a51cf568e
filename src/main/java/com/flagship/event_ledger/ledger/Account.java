package com.flagship.event_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * A ledger account. Player wallets are LIABILITY accounts keyed by their chain address.
 */
@Value
public class Account {

    /** Player funds held by the platform before they are staked. */
    public static final String WAGER_ESCROW = "platform:wager-escrow";
    /** Platform cash backing deposits and withdrawals. */
    public static final String PLATFORM_CASH = "platform:cash";
    /** House result: receives lost stakes, funds winnings above the stake. */
    public static final String HOUSE = "platform:house";

    UUID id;
    String accountNumber;
    AccountType accountType;
}
