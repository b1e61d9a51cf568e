package com.flagship.event_ledger.wagering;

import java.util.UUID;

public class BetNotFoundException extends RuntimeException {

    public BetNotFoundException(UUID betId) {
        super("Bet not found: " + betId);
    }
}
