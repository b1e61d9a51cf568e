package com.flagship.event_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A balanced set of postings. Sum of debits must equal sum of credits.
 */
@Value
public class TransactionRequest {
    String description;
    List<Posting> debits;
    List<Posting> credits;

    /**
     * Single debit against a single credit of the same amount.
     */
    public static TransactionRequest transfer(String description, UUID debitAccountId,
                                              UUID creditAccountId, BigDecimal amount) {
        return new TransactionRequest(description,
                List.of(Posting.of(debitAccountId, amount, description)),
                List.of(Posting.of(creditAccountId, amount, description)));
    }

    public boolean isBalanced() {
        return getDebitTotal().compareTo(getCreditTotal()) == 0;
    }

    public BigDecimal getDebitTotal() {
        return sum(debits);
    }

    public BigDecimal getCreditTotal() {
        return sum(credits);
    }

    public List<UUID> accountIds() {
        List<UUID> ids = new ArrayList<>();
        debits.forEach(p -> ids.add(p.getAccountId()));
        credits.forEach(p -> ids.add(p.getAccountId()));
        return ids;
    }

    private static BigDecimal sum(List<Posting> postings) {
        return postings.stream()
                .map(Posting::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Value
    public static class Posting {
        UUID accountId;
        BigDecimal amount;
        String description;

        private Posting(UUID accountId, BigDecimal amount, String description) {
            this.accountId = Objects.requireNonNull(accountId);
            this.amount = Objects.requireNonNull(amount);
            if (amount.signum() <= 0) {
                throw new IllegalArgumentException("Posting amount must be positive: " + amount);
            }
            this.description = description;
        }

        public static Posting of(UUID accountId, BigDecimal amount, String description) {
            return new Posting(accountId, amount, description);
        }
    }
}
