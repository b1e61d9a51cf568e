package com.flagship.event_ledger.wagering;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

import static com.flagship.event_ledger.common.JdbcTimestamps.fromDb;
import static com.flagship.event_ledger.common.JdbcTimestamps.toDb;

/**
 * JDBC access to settlements. The unique bet_id constraint is the last line
 * against a bet being settled twice.
 */
@Repository
public class SettlementRepository {

    private static final String COLUMNS =
        "id, bet_id, outcome, payout, status, failure_reason, ledger_transaction_id, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;

    public SettlementRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Settlement settlement) {
        jdbcTemplate.update(
            "INSERT INTO settlements (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            settlement.getId(),
            settlement.getBetId(),
            settlement.getOutcome().name(),
            settlement.getPayout(),
            settlement.getStatus().name(),
            settlement.getFailureReason(),
            settlement.getLedgerTransactionId(),
            toDb(settlement.getCreatedAt()),
            toDb(settlement.getUpdatedAt())
        );
    }

    public void update(Settlement settlement) {
        jdbcTemplate.update(
            "UPDATE settlements SET outcome = ?, payout = ?, status = ?, failure_reason = ?, " +
            "ledger_transaction_id = ?, created_at = ?, updated_at = ? WHERE id = ?",
            settlement.getOutcome().name(),
            settlement.getPayout(),
            settlement.getStatus().name(),
            settlement.getFailureReason(),
            settlement.getLedgerTransactionId(),
            toDb(settlement.getCreatedAt()),
            toDb(settlement.getUpdatedAt()),
            settlement.getId()
        );
    }

    public Optional<Settlement> findByBetId(UUID betId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM settlements WHERE bet_id = ?", settlementRowMapper(), betId)
            .stream().findFirst();
    }

    private RowMapper<Settlement> settlementRowMapper() {
        return (rs, rowNum) -> Settlement.builder()
            .id(rs.getObject("id", UUID.class))
            .betId(rs.getObject("bet_id", UUID.class))
            .outcome(SettlementOutcome.valueOf(rs.getString("outcome")))
            .payout(rs.getBigDecimal("payout"))
            .status(SettlementStatus.valueOf(rs.getString("status")))
            .failureReason(rs.getString("failure_reason"))
            .ledgerTransactionId(rs.getObject("ledger_transaction_id", UUID.class))
            .createdAt(fromDb(rs, "created_at"))
            .updatedAt(fromDb(rs, "updated_at"))
            .build();
    }
}
