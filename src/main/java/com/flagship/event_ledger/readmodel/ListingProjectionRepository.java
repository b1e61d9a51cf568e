package com.flagship.event_ledger.readmodel;

import com.flagship.event_ledger.listing.Listing;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.flagship.event_ledger.common.JdbcTimestamps.toDb;

/**
 * Writes to {@code listings_read}. Every write to the read model goes through here;
 * {@link ListingReadRepository} only reads.
 */
@Repository
public class ListingProjectionRepository {

    private final JdbcTemplate jdbcTemplate;

    public ListingProjectionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Copies the denormalized fields of {@code listing} into its read row, inserting
     * the row with zero counters when absent. Cached counters are left alone.
     *
     * @param force also overwrite a row projected from a newer version
     * @return true if the row was written
     */
    public boolean project(Listing listing, Instant now, boolean force) {
        int updated = jdbcTemplate.update(
            "UPDATE listings_read SET title = ?, organizer_name = ?, status = ?, capacity = ?, " +
            "start_date = ?, end_date = ?, is_deleted = ?, source_version = ?, refreshed_at = ? " +
            "WHERE id = ?" + (force ? "" : " AND source_version <= ?"),
            force ? projectionArgs(listing, now) : withVersionGuard(listing, now)
        );
        if (updated > 0) {
            return true;
        }
        if (exists(listing.getId())) {
            return false;
        }
        jdbcTemplate.update(
            "INSERT INTO listings_read (id, title, organizer_name, status, capacity, start_date, end_date, " +
            "is_deleted, source_version, registered_count, attendance_count, last_activity_at, refreshed_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, 0, 0, NULL, ?)",
            listing.getId(),
            listing.getTitle(),
            listing.getOrganizerName(),
            listing.getStatus().name(),
            listing.getCapacity(),
            toDb(listing.getStartDate()),
            toDb(listing.getEndDate()),
            listing.isDeleted(),
            listing.getVersion(),
            toDb(now)
        );
        return true;
    }

    /**
     * Locks every non-deleted read row in id order, so two full refreshes
     * cannot deadlock on each other.
     */
    public List<UUID> lockNonDeleted() {
        return jdbcTemplate.queryForList(
            "SELECT id FROM listings_read WHERE is_deleted = FALSE ORDER BY id FOR UPDATE", UUID.class);
    }

    /**
     * Locks one row.
     *
     * @return the row's deleted flag, or empty when there is no row
     */
    public Optional<Boolean> lockRow(UUID id) {
        return jdbcTemplate.queryForList(
            "SELECT is_deleted FROM listings_read WHERE id = ? FOR UPDATE", Boolean.class, id)
            .stream().findFirst();
    }

    public void updateCounts(List<ListingCounts> counts, Instant now) {
        jdbcTemplate.batchUpdate(
            "UPDATE listings_read SET registered_count = ?, attendance_count = ?, " +
            "last_activity_at = ?, refreshed_at = ? WHERE id = ?",
            counts,
            500,
            (ps, c) -> {
                ps.setLong(1, c.getRegisteredCount());
                ps.setLong(2, c.getAttendanceCount());
                ps.setObject(3, toDb(c.getLastActivityAt()));
                ps.setObject(4, toDb(now));
                ps.setObject(5, c.getListingId());
            }
        );
    }

    private boolean exists(UUID id) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM listings_read WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    private Object[] projectionArgs(Listing listing, Instant now) {
        return new Object[] {
            listing.getTitle(),
            listing.getOrganizerName(),
            listing.getStatus().name(),
            listing.getCapacity(),
            toDb(listing.getStartDate()),
            toDb(listing.getEndDate()),
            listing.isDeleted(),
            listing.getVersion(),
            toDb(now),
            listing.getId()
        };
    }

    private Object[] withVersionGuard(Listing listing, Instant now) {
        Object[] base = projectionArgs(listing, now);
        Object[] args = new Object[base.length + 1];
        System.arraycopy(base, 0, args, 0, base.length);
        args[base.length] = listing.getVersion();
        return args;
    }
}
