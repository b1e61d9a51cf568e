package com.flagship.event_ledger.reconciliation.rule;

import com.flagship.event_ledger.ledger.LedgerService;
import com.flagship.event_ledger.reconciliation.Inconsistency;
import com.flagship.event_ledger.reconciliation.InconsistencyKind;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accounts whose balance, derived from their entries, is below zero.
 */
@Component
public class NegativeBalanceRule implements ReconciliationRule {

    private static final String SQL =
        "SELECT a.id, a.account_number, a.account_type, " + LedgerService.balanceExpression() + " AS balance " +
        "FROM accounts a LEFT JOIN ledger_entries e ON e.account_id = a.id " +
        "GROUP BY a.id, a.account_number, a.account_type " +
        "HAVING " + LedgerService.balanceExpression() + " < 0 " +
        "ORDER BY a.account_number";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public NegativeBalanceRule(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "negative-balances";
    }

    @Override
    public InconsistencyKind kind() {
        return InconsistencyKind.NEGATIVE_BALANCE;
    }

    @Override
    public List<Inconsistency> detect() {
        Instant now = clock.instant();
        return jdbcTemplate.query(SQL, (rs, rowNum) -> {
            BigDecimal balance = rs.getBigDecimal("balance");
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("accountNumber", rs.getString("account_number"));
            details.put("accountType", rs.getString("account_type"));
            details.put("balance", balance);
            return new Inconsistency(kind(), rs.getString("id"), details, now);
        });
    }
}
