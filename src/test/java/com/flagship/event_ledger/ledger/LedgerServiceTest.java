package com.flagship.event_ledger.ledger;

import com.flagship.event_ledger.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the ledger: unbalanced transactions, unknown accounts,
 * and checks the balance sign convention per account type.
 */
@SpringBootTest
@ActiveProfiles("test")
class LedgerServiceTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID cash;
    private UUID wallet;

    @BeforeEach
    void setUp() {
        TestDatabase.clean(jdbcTemplate);
        cash = accountService.ensureAccount(Account.PLATFORM_CASH, AccountType.ASSET);
        wallet = accountService.ensureWallet("GWALLET" + UUID.randomUUID().toString().substring(0, 8));
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @Test
    @DisplayName("Balanced transfer posts two entries and moves both balances")
    void testValidBalancedTransaction() {
        printTestHeader("Valid Balanced Transaction");

        UUID txId = ledgerService.postTransaction(
            TransactionRequest.transfer("Deposit", cash, wallet, new BigDecimal("100.00")));

        List<LedgerEntry> entries = ledgerService.getLedgerEntriesForTransaction(txId);
        printOutput("Ledger Entries", entries);
        assertEquals(2, entries.size());
        assertEquals(EntryType.DEBIT, entries.get(0).getEntryType());
        assertEquals(EntryType.CREDIT, entries.get(1).getEntryType());

        // ASSET is debit-normal, LIABILITY credit-normal: both grow
        assertEquals(0, new BigDecimal("100.00").compareTo(ledgerService.getAccountBalance(cash)));
        assertEquals(0, new BigDecimal("100.00").compareTo(ledgerService.getAccountBalance(wallet)));
    }

    @Test
    @DisplayName("Unbalanced transaction is rejected and nothing is written")
    void testImbalancedTransactionRejected() {
        printTestHeader("Imbalanced Transaction");

        TransactionRequest request = new TransactionRequest("Broken",
            List.of(TransactionRequest.Posting.of(cash, new BigDecimal("100.00"), "debit")),
            List.of(TransactionRequest.Posting.of(wallet, new BigDecimal("99.99"), "credit")));

        assertFalse(request.isBalanced());
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ledgerService.postTransaction(request));
        printOutput("Exception", e.getMessage());

        assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ledger_entries", Integer.class));
    }

    @Test
    @DisplayName("Posting against an unknown account is rejected")
    void testUnknownAccountRejected() {
        UUID unknown = UUID.randomUUID();

        assertThrows(IllegalArgumentException.class, () -> ledgerService.postTransaction(
            TransactionRequest.transfer("Ghost", cash, unknown, BigDecimal.TEN)));
        assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ledger_transactions", Integer.class));
    }

    @Test
    @DisplayName("Zero and negative postings are rejected at construction")
    void testNonPositivePostingRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> TransactionRequest.Posting.of(cash, BigDecimal.ZERO, "zero"));
        assertThrows(IllegalArgumentException.class,
            () -> TransactionRequest.Posting.of(cash, new BigDecimal("-1"), "negative"));
    }

    @Test
    @DisplayName("Debiting a wallet beyond its funds produces a negative balance")
    void testOverdrawnWalletGoesNegative() {
        UUID escrow = accountService.ensureAccount(Account.WAGER_ESCROW, AccountType.LIABILITY);
        ledgerService.postTransaction(TransactionRequest.transfer("Deposit", cash, wallet, new BigDecimal("10")));
        ledgerService.postTransaction(TransactionRequest.transfer("Stake", wallet, escrow, new BigDecimal("25")));

        BigDecimal balance = ledgerService.getAccountBalance(wallet);
        printOutput("Wallet balance", balance);
        assertEquals(0, new BigDecimal("-15").compareTo(balance));
    }

    @Test
    @DisplayName("ensureAccount is idempotent and refuses a type change")
    void testEnsureAccountIdempotent() {
        UUID again = accountService.ensureAccount(Account.PLATFORM_CASH, AccountType.ASSET);
        assertEquals(cash, again);

        assertThrows(IllegalStateException.class,
            () -> accountService.ensureAccount(Account.PLATFORM_CASH, AccountType.EQUITY));
    }
}
