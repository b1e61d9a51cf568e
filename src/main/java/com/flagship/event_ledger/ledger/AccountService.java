package com.flagship.event_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Account lookup and lazy creation. Wallet accounts appear the first time an
 * address shows up in a chain event.
 */
@Service
public class AccountService {

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Returns the id of the account with this number, creating it if needed.
     * Safe under concurrent callers: the insert is a no-op when another
     * transaction created the account first.
     *
     * @throws IllegalStateException if the account exists with a different type
     */
    @Transactional
    public UUID ensureAccount(String accountNumber, AccountType type) {
        jdbcTemplate.update(
            "INSERT INTO accounts (id, account_number, account_type, created_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP) ON CONFLICT DO NOTHING",
            UUID.randomUUID(),
            accountNumber,
            type.name()
        );
        Account account = findByNumber(accountNumber)
            .orElseThrow(() -> new IllegalStateException("Account vanished after insert: " + accountNumber));
        if (account.getAccountType() != type) {
            throw new IllegalStateException(String.format(
                "Account %s is %s, expected %s", accountNumber, account.getAccountType(), type));
        }
        return account.getId();
    }

    public UUID ensureWallet(String address) {
        return ensureAccount(address, AccountType.LIABILITY);
    }

    public Optional<Account> findByNumber(String accountNumber) {
        List<Account> rows = jdbcTemplate.query(
            "SELECT id, account_number, account_type FROM accounts WHERE account_number = ?",
            (rs, rowNum) -> new Account(
                rs.getObject("id", UUID.class),
                rs.getString("account_number"),
                AccountType.valueOf(rs.getString("account_type"))),
            accountNumber
        );
        return rows.stream().findFirst();
    }
}
