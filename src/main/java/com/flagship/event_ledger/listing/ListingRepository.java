package com.flagship.event_ledger.listing;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.flagship.event_ledger.common.JdbcTimestamps.fromDb;
import static com.flagship.event_ledger.common.JdbcTimestamps.toDb;

/**
 * JDBC access to the listing write model.
 *
 * Writes go through a conditional update on the version column so a stale writer
 * can never overwrite a newer row, whatever locking the caller did beforehand.
 */
@Repository
public class ListingRepository {

    private static final String COLUMNS =
        "id, title, organizer_id, organizer_name, capacity, status, start_date, end_date, " +
        "deleted, version, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;

    public ListingRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Inserts a new listing.
     *
     * @throws org.springframework.dao.DuplicateKeyException if the id is taken
     */
    public void insert(Listing listing) {
        jdbcTemplate.update(
            "INSERT INTO listings (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            listing.getId(),
            listing.getTitle(),
            listing.getOrganizerId(),
            listing.getOrganizerName(),
            listing.getCapacity(),
            listing.getStatus().name(),
            toDb(listing.getStartDate()),
            toDb(listing.getEndDate()),
            listing.isDeleted(),
            listing.getVersion(),
            toDb(listing.getCreatedAt()),
            toDb(listing.getUpdatedAt())
        );
    }

    /**
     * Writes {@code updated} only if the stored row is still at {@code expectedVersion}.
     *
     * @return number of rows written (0 means another writer got there first)
     */
    public int updateIfVersion(Listing updated, long expectedVersion) {
        return jdbcTemplate.update(
            "UPDATE listings SET title = ?, organizer_id = ?, organizer_name = ?, capacity = ?, " +
            "status = ?, start_date = ?, end_date = ?, deleted = ?, version = ?, updated_at = ? " +
            "WHERE id = ? AND version = ?",
            updated.getTitle(),
            updated.getOrganizerId(),
            updated.getOrganizerName(),
            updated.getCapacity(),
            updated.getStatus().name(),
            toDb(updated.getStartDate()),
            toDb(updated.getEndDate()),
            updated.isDeleted(),
            updated.getVersion(),
            toDb(updated.getUpdatedAt()),
            updated.getId(),
            expectedVersion
        );
    }

    public Optional<Listing> findById(UUID id) {
        List<Listing> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM listings WHERE id = ?", listingRowMapper(), id);
        return rows.stream().findFirst();
    }

    /**
     * Loads the row and holds its lock until the surrounding transaction ends.
     */
    public Optional<Listing> findByIdForUpdate(UUID id) {
        List<Listing> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM listings WHERE id = ? FOR UPDATE", listingRowMapper(), id);
        return rows.stream().findFirst();
    }

    public Optional<Long> findVersion(UUID id) {
        List<Long> versions = jdbcTemplate.queryForList(
            "SELECT version FROM listings WHERE id = ?", Long.class, id);
        return versions.stream().findFirst();
    }

    private RowMapper<Listing> listingRowMapper() {
        return (rs, rowNum) -> Listing.builder()
            .id(rs.getObject("id", UUID.class))
            .title(rs.getString("title"))
            .organizerId(rs.getString("organizer_id"))
            .organizerName(rs.getString("organizer_name"))
            .capacity(rs.getInt("capacity"))
            .status(ListingStatus.valueOf(rs.getString("status")))
            .startDate(fromDb(rs, "start_date"))
            .endDate(fromDb(rs, "end_date"))
            .deleted(rs.getBoolean("deleted"))
            .version(rs.getLong("version"))
            .createdAt(fromDb(rs, "created_at"))
            .updatedAt(fromDb(rs, "updated_at"))
            .build();
    }
}
