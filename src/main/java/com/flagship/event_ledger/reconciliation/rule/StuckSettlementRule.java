package com.flagship.event_ledger.reconciliation.rule;

import com.flagship.event_ledger.config.ReconciliationProperties;
import com.flagship.event_ledger.reconciliation.Inconsistency;
import com.flagship.event_ledger.reconciliation.InconsistencyKind;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.flagship.event_ledger.common.JdbcTimestamps.fromDb;
import static com.flagship.event_ledger.common.JdbcTimestamps.toDb;

/**
 * Settlements still PENDING or PROCESSING longer than the configured threshold.
 * A settlement exactly at the threshold is not stuck yet.
 */
@Component
public class StuckSettlementRule implements ReconciliationRule {

    private static final String SQL =
        "SELECT id, bet_id, status, created_at FROM settlements " +
        "WHERE status IN ('PENDING', 'PROCESSING') AND created_at < ? " +
        "ORDER BY created_at, id";

    private final JdbcTemplate jdbcTemplate;
    private final ReconciliationProperties properties;
    private final Clock clock;

    public StuckSettlementRule(JdbcTemplate jdbcTemplate, ReconciliationProperties properties, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "stuck-settlements";
    }

    @Override
    public InconsistencyKind kind() {
        return InconsistencyKind.STUCK_SETTLEMENT;
    }

    @Override
    public List<Inconsistency> detect() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(properties.getStuckSettlementThreshold());
        return jdbcTemplate.query(SQL, (rs, rowNum) -> {
            Instant createdAt = fromDb(rs, "created_at");
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("betId", rs.getString("bet_id"));
            details.put("status", rs.getString("status"));
            details.put("ageSeconds", Duration.between(createdAt, now).getSeconds());
            return new Inconsistency(kind(), rs.getString("id"), details, now);
        }, toDb(cutoff));
    }
}
