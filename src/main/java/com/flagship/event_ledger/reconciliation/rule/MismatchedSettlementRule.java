package com.flagship.event_ledger.reconciliation.rule;

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
 * Completed settlements whose payout differs from the payout recorded on the bet,
 * by any amount, or whose bet has no payout recorded. Amounts are compared by value
 * so 100.00 and 100.0000 match while 100.00 and 99.99 do not.
 */
@Component
public class MismatchedSettlementRule implements ReconciliationRule {

    private static final String SQL =
        "SELECT s.id AS settlement_id, s.bet_id, s.payout AS settlement_payout, b.payout AS bet_payout " +
        "FROM settlements s JOIN bets b ON b.id = s.bet_id " +
        "WHERE s.status = 'COMPLETED' AND (b.payout IS NULL OR b.payout <> s.payout) " +
        "ORDER BY s.created_at, s.id";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public MismatchedSettlementRule(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "mismatched-settlements";
    }

    @Override
    public InconsistencyKind kind() {
        return InconsistencyKind.MISMATCHED_SETTLEMENT;
    }

    @Override
    public List<Inconsistency> detect() {
        Instant now = clock.instant();
        return jdbcTemplate.query(SQL, (rs, rowNum) -> {
            BigDecimal settlementPayout = rs.getBigDecimal("settlement_payout");
            BigDecimal betPayout = rs.getBigDecimal("bet_payout");
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("settlementId", rs.getString("settlement_id"));
            details.put("betPayout", betPayout);
            details.put("settlementPayout", settlementPayout);
            details.put("difference", betPayout == null ? null : settlementPayout.subtract(betPayout));
            return new Inconsistency(kind(), rs.getString("bet_id"), details, now);
        }).stream().filter(MismatchedSettlementRule::differs).toList();
    }

    private static boolean differs(Inconsistency inconsistency) {
        Object difference = inconsistency.getDetails().get("difference");
        return difference == null || ((BigDecimal) difference).signum() != 0;
    }
}
