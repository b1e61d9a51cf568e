package com.flagship.event_ledger.reconciliation.rule;

import com.flagship.event_ledger.reconciliation.Inconsistency;
import com.flagship.event_ledger.reconciliation.InconsistencyKind;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bets on a listing that is missing from the write model or soft-deleted.
 * Voided bets are excluded: voiding is how a deleted listing's bets are closed.
 */
@Component
public class OrphanedBetRule implements ReconciliationRule {

    private static final String SQL =
        "SELECT b.id, b.listing_id, b.stake, l.id AS found_listing_id " +
        "FROM bets b LEFT JOIN listings l ON l.id = b.listing_id " +
        "WHERE b.status <> 'VOID' AND (l.id IS NULL OR l.deleted = TRUE) " +
        "ORDER BY b.created_at, b.id";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public OrphanedBetRule(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "orphaned-bets";
    }

    @Override
    public InconsistencyKind kind() {
        return InconsistencyKind.ORPHANED_BET;
    }

    @Override
    public List<Inconsistency> detect() {
        Instant now = clock.instant();
        return jdbcTemplate.query(SQL, (rs, rowNum) -> {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("listingId", rs.getString("listing_id"));
            details.put("reason", rs.getString("found_listing_id") == null ? "MISSING" : "DELETED");
            details.put("stake", rs.getBigDecimal("stake"));
            return new Inconsistency(kind(), rs.getString("id"), details, now);
        });
    }
}
