package com.flagship.event_ledger.wagering;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.flagship.event_ledger.common.JdbcTimestamps.fromDb;
import static com.flagship.event_ledger.common.JdbcTimestamps.toDb;

@Repository
public class BetRepository {

    private static final String COLUMNS =
        "id, listing_id, account_id, stake, odds, payout, status, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;

    public BetRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Bet bet) {
        jdbcTemplate.update(
            "INSERT INTO bets (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            bet.getId(),
            bet.getListingId(),
            bet.getAccountId(),
            bet.getStake(),
            bet.getOdds(),
            bet.getPayout(),
            bet.getStatus().name(),
            toDb(bet.getCreatedAt()),
            toDb(bet.getUpdatedAt())
        );
    }

    public void update(Bet bet) {
        jdbcTemplate.update(
            "UPDATE bets SET payout = ?, status = ?, updated_at = ? WHERE id = ?",
            bet.getPayout(),
            bet.getStatus().name(),
            toDb(bet.getUpdatedAt()),
            bet.getId()
        );
    }

    public Optional<Bet> findById(UUID id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM bets WHERE id = ?", betRowMapper(), id)
            .stream().findFirst();
    }

    public Optional<Bet> findByIdForUpdate(UUID id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM bets WHERE id = ? FOR UPDATE", betRowMapper(), id)
            .stream().findFirst();
    }

    public List<UUID> findOpenBetIdsByListing(UUID listingId) {
        return jdbcTemplate.queryForList(
            "SELECT id FROM bets WHERE listing_id = ? AND status = 'OPEN' ORDER BY created_at",
            UUID.class,
            listingId
        );
    }

    private RowMapper<Bet> betRowMapper() {
        return (rs, rowNum) -> Bet.builder()
            .id(rs.getObject("id", UUID.class))
            .listingId(rs.getObject("listing_id", UUID.class))
            .accountId(rs.getObject("account_id", UUID.class))
            .stake(rs.getBigDecimal("stake"))
            .odds(rs.getBigDecimal("odds"))
            .payout(rs.getBigDecimal("payout"))
            .status(BetStatus.valueOf(rs.getString("status")))
            .createdAt(fromDb(rs, "created_at"))
            .updatedAt(fromDb(rs, "updated_at"))
            .build();
    }
}
