package com.flagship.event_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Posts balanced transactions to the double-entry ledger.
 *
 * Invariants:
 * 1. Debits equal credits in every transaction
 * 2. Entries are immutable once written
 * 3. Balances are derived from entries, never stored
 *
 * Entries are not checked against available balance: the chain is the source of
 * truth, and an overdrawn wallet is reported by reconciliation instead of rejected here.
 */
@Service
public class LedgerService {

    private static final String BALANCE_EXPRESSION =
        "COALESCE(SUM(CASE " +
        "  WHEN a.account_type = 'ASSET' AND e.entry_type = 'DEBIT' THEN e.amount " +
        "  WHEN a.account_type = 'ASSET' AND e.entry_type = 'CREDIT' THEN -e.amount " +
        "  WHEN a.account_type <> 'ASSET' AND e.entry_type = 'CREDIT' THEN e.amount " +
        "  WHEN a.account_type <> 'ASSET' AND e.entry_type = 'DEBIT' THEN -e.amount " +
        "  ELSE 0 END), 0)";

    private final JdbcTemplate jdbcTemplate;

    public LedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * SQL expression for the derived balance of account alias {@code a} over
     * left-joined entries alias {@code e}. Shared with the negative balance rule.
     */
    public static String balanceExpression() {
        return BALANCE_EXPRESSION;
    }

    /**
     * Posts a transaction.
     *
     * @return id of the ledger transaction
     * @throws IllegalArgumentException if the request is unbalanced or names an unknown account
     */
    @Transactional
    public UUID postTransaction(TransactionRequest request) {
        if (!request.isBalanced()) {
            throw new IllegalArgumentException(String.format(
                "Transaction is not balanced: debits=%s, credits=%s",
                request.getDebitTotal(), request.getCreditTotal()));
        }
        validateAccountsExist(request);

        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO ledger_transactions (id, description, created_at) VALUES (?, ?, CURRENT_TIMESTAMP)",
            transactionId,
            request.getDescription()
        );

        List<Object[]> rows = new ArrayList<>();
        request.getDebits().forEach(p -> rows.add(entryRow(transactionId, p, EntryType.DEBIT)));
        request.getCredits().forEach(p -> rows.add(entryRow(transactionId, p, EntryType.CREDIT)));
        jdbcTemplate.batchUpdate(
            "INSERT INTO ledger_entries (id, transaction_id, account_id, amount, entry_type, description, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            rows
        );
        return transactionId;
    }

    public BigDecimal getAccountBalance(UUID accountId) {
        List<BigDecimal> balances = jdbcTemplate.queryForList(
            "SELECT " + BALANCE_EXPRESSION + " AS balance FROM accounts a " +
            "LEFT JOIN ledger_entries e ON e.account_id = a.id " +
            "WHERE a.id = ? GROUP BY a.id",
            BigDecimal.class,
            accountId
        );
        if (balances.isEmpty()) {
            throw new IllegalArgumentException("Account not found: " + accountId);
        }
        return balances.get(0);
    }

    public List<LedgerEntry> getLedgerEntriesForTransaction(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT id, transaction_id, account_id, amount, entry_type, description, sequence_number " +
            "FROM ledger_entries WHERE transaction_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            transactionId
        );
    }

    private Object[] entryRow(UUID transactionId, TransactionRequest.Posting posting, EntryType type) {
        return new Object[] {
            UUID.randomUUID(), transactionId, posting.getAccountId(), posting.getAmount(),
            type.name(), posting.getDescription()
        };
    }

    private void validateAccountsExist(TransactionRequest request) {
        Set<UUID> ids = new HashSet<>(request.accountIds());
        for (UUID accountId : ids) {
            Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM accounts WHERE id = ?", Integer.class, accountId);
            if (count == null || count == 0) {
                throw new IllegalArgumentException("Account not found: " + accountId);
            }
        }
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getObject("transaction_id", UUID.class),
            rs.getObject("account_id", UUID.class),
            rs.getBigDecimal("amount"),
            EntryType.valueOf(rs.getString("entry_type")),
            rs.getString("description"),
            rs.getLong("sequence_number")
        );
    }
}
