package com.flagship.event_ledger.wagering;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Result a settlement assigns to its bet.
 */
public enum SettlementOutcome {
    WON(BetStatus.WON),
    LOST(BetStatus.LOST),
    VOID(BetStatus.VOID);

    private final BetStatus betStatus;

    SettlementOutcome(BetStatus betStatus) {
        this.betStatus = betStatus;
    }

    public BetStatus betStatus() {
        return betStatus;
    }

    /**
     * Payout implied by the outcome when the settlement request does not state one:
     * stake * odds for a win, nothing for a loss, the stake back for a void.
     */
    public BigDecimal defaultPayout(BigDecimal stake, BigDecimal odds) {
        return switch (this) {
            case WON -> stake.multiply(odds).setScale(4, RoundingMode.HALF_EVEN);
            case LOST -> BigDecimal.ZERO;
            case VOID -> stake;
        };
    }
}
