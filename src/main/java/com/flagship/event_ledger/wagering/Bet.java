package com.flagship.event_ledger.wagering;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A stake placed by a wallet on a listing. Immutable; transitions return new instances.
 */
@Value
@Builder(toBuilder = true)
public class Bet {
    UUID id;
    UUID listingId;
    UUID accountId;
    BigDecimal stake;
    BigDecimal odds;
    /** Payout recorded on chain at settlement; null while open. */
    BigDecimal payout;
    BetStatus status;
    Instant createdAt;
    Instant updatedAt;

    /**
     * @throws IllegalArgumentException if stake is not positive or odds are below 1
     */
    public static Bet place(UUID id, UUID listingId, UUID accountId,
                            BigDecimal stake, BigDecimal odds, Instant now) {
        if (id == null || listingId == null || accountId == null) {
            throw new IllegalArgumentException("Bet id, listingId and account are required");
        }
        if (stake == null || stake.signum() <= 0) {
            throw new IllegalArgumentException("Bet stake must be positive: " + stake);
        }
        if (odds == null || odds.compareTo(BigDecimal.ONE) < 0) {
            throw new IllegalArgumentException("Bet odds must be at least 1: " + odds);
        }
        return new Bet(id, listingId, accountId, stake, odds, null, BetStatus.OPEN, now, now);
    }

    /**
     * Closes the bet with the given outcome.
     *
     * @throws IllegalStateException if the bet is not OPEN
     */
    public Bet settle(SettlementOutcome outcome, BigDecimal recordedPayout, Instant now) {
        if (status != BetStatus.OPEN) {
            throw new IllegalStateException(
                String.format("Cannot settle bet %s in %s status. Only OPEN bets can be settled.", id, status));
        }
        return toBuilder()
            .status(outcome.betStatus())
            .payout(recordedPayout)
            .updatedAt(now)
            .build();
    }

    public boolean isOpen() {
        return status == BetStatus.OPEN;
    }
}
