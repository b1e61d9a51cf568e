package com.flagship.event_ledger.wagering;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Settlement of one bet, with an explicit state machine (see {@link SettlementStatus}).
 * At most one settlement exists per bet; a failed one is reopened rather than replaced.
 */
@Value
@Builder(toBuilder = true)
public class Settlement {
    UUID id;
    UUID betId;
    SettlementOutcome outcome;
    BigDecimal payout;
    SettlementStatus status;
    String failureReason;
    UUID ledgerTransactionId;
    Instant createdAt;
    Instant updatedAt;

    public static Settlement request(UUID betId, SettlementOutcome outcome, BigDecimal payout, Instant now) {
        if (payout == null || payout.signum() < 0) {
            throw new IllegalArgumentException("Settlement payout must not be negative: " + payout);
        }
        return new Settlement(UUID.randomUUID(), betId, outcome, payout,
            SettlementStatus.PENDING, null, null, now, now);
    }

    public Settlement startProcessing(Instant now) {
        requireStatus(SettlementStatus.PENDING, "start processing");
        return toBuilder().status(SettlementStatus.PROCESSING).updatedAt(now).build();
    }

    public Settlement complete(UUID ledgerTransactionId, Instant now) {
        requireNonTerminal("complete");
        return toBuilder()
            .status(SettlementStatus.COMPLETED)
            .ledgerTransactionId(ledgerTransactionId)
            .updatedAt(now)
            .build();
    }

    public Settlement fail(String reason, Instant now) {
        requireNonTerminal("fail");
        return toBuilder().status(SettlementStatus.FAILED).failureReason(reason).updatedAt(now).build();
    }

    /**
     * Starts a failed settlement over. The age used for stuck detection restarts too.
     */
    public Settlement reopen(SettlementOutcome newOutcome, BigDecimal newPayout, Instant now) {
        requireStatus(SettlementStatus.FAILED, "reopen");
        if (newPayout == null || newPayout.signum() < 0) {
            throw new IllegalArgumentException("Settlement payout must not be negative: " + newPayout);
        }
        return toBuilder()
            .outcome(newOutcome)
            .payout(newPayout)
            .status(SettlementStatus.PENDING)
            .failureReason(null)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    private void requireStatus(SettlementStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException(String.format(
                "Cannot %s settlement %s in %s status", action, id, status));
        }
    }

    private void requireNonTerminal(String action) {
        if (status.isTerminal()) {
            throw new IllegalStateException(String.format(
                "Cannot %s settlement %s in terminal %s status", action, id, status));
        }
    }
}
