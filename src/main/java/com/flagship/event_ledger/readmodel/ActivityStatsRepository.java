package com.flagship.event_ledger.readmodel;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static com.flagship.event_ledger.common.JdbcTimestamps.fromDb;

/**
 * Aggregates over the engagement tables that feed the read-model counters.
 *
 * Counts are computed with one GROUP BY per table rather than a correlated
 * subquery per row, so a full refresh costs a fixed number of scans.
 */
@Repository
public class ActivityStatsRepository {

    private static final String REGISTERED =
        "SELECT listing_id, COUNT(*) AS cnt FROM registrations WHERE status = 'CONFIRMED'";
    private static final String ATTENDED =
        "SELECT listing_id, COUNT(*) AS cnt FROM attendances WHERE status = 'ATTENDED'";
    private static final String LAST_ACTIVITY =
        "SELECT listing_id, MAX(activity_at) AS last_activity FROM (" +
        "  SELECT listing_id, updated_at AS activity_at FROM registrations" +
        "  UNION ALL SELECT listing_id, created_at FROM attendances" +
        "  UNION ALL SELECT listing_id, created_at FROM event_feedback" +
        ") activity";

    private final JdbcTemplate jdbcTemplate;

    public ActivityStatsRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Counters of every listing with any engagement. Listings without rows are absent.
     */
    public Map<UUID, ListingCounts> countsForAll() {
        Map<UUID, Long> registered = countBy(REGISTERED + " GROUP BY listing_id");
        Map<UUID, Long> attended = countBy(ATTENDED + " GROUP BY listing_id");
        Map<UUID, Instant> lastActivity = new HashMap<>();
        jdbcTemplate.query(LAST_ACTIVITY + " GROUP BY listing_id", rs -> {
            lastActivity.put(rs.getObject("listing_id", UUID.class), fromDb(rs, "last_activity"));
        });

        Map<UUID, ListingCounts> counts = new HashMap<>();
        for (UUID id : lastActivity.keySet()) {
            counts.put(id, new ListingCounts(
                id,
                registered.getOrDefault(id, 0L),
                attended.getOrDefault(id, 0L),
                lastActivity.get(id)));
        }
        return counts;
    }

    public ListingCounts countsFor(UUID listingId) {
        Long registered = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM registrations WHERE status = 'CONFIRMED' AND listing_id = ?",
            Long.class, listingId);
        Long attended = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM attendances WHERE status = 'ATTENDED' AND listing_id = ?",
            Long.class, listingId);
        Instant lastActivity = jdbcTemplate.query(
            LAST_ACTIVITY + " WHERE listing_id = ? GROUP BY listing_id",
            rs -> rs.next() ? fromDb(rs, "last_activity") : null,
            listingId);
        return new ListingCounts(
            listingId,
            registered != null ? registered : 0L,
            attended != null ? attended : 0L,
            lastActivity);
    }

    private Map<UUID, Long> countBy(String sql) {
        Map<UUID, Long> result = new HashMap<>();
        jdbcTemplate.query(sql, rs -> {
            result.put(rs.getObject("listing_id", UUID.class), rs.getLong("cnt"));
        });
        return result;
    }
}
