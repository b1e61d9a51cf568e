package com.flagship.event_ledger.listing;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

import static com.flagship.event_ledger.common.JdbcTimestamps.fromDb;
import static com.flagship.event_ledger.common.JdbcTimestamps.toDb;

/**
 * Append-only access to the listing version log. Rows are never updated or deleted.
 */
@Repository
public class ListingVersionRepository {

    private static final String COLUMNS =
        "id, aggregate_id, from_version, to_version, operation, applied_at, snapshot, source_event_id";

    private final JdbcTemplate jdbcTemplate;

    public ListingVersionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException if (aggregateId, toVersion) already exists
     */
    public void append(ListingVersion version) {
        jdbcTemplate.update(
            "INSERT INTO listing_versions " +
            "(aggregate_id, from_version, to_version, operation, applied_at, snapshot, source_event_id) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            version.getAggregateId(),
            version.getFromVersion(),
            version.getToVersion(),
            version.getOperation().name(),
            toDb(version.getAppliedAt()),
            version.getSnapshot(),
            version.getSourceEventId()
        );
    }

    public List<ListingVersion> findByAggregateId(UUID aggregateId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM listing_versions WHERE aggregate_id = ? ORDER BY to_version",
            versionRowMapper(),
            aggregateId
        );
    }

    /**
     * Latest entry per aggregate, used to replay the write model into the read model.
     */
    public List<ListingVersion> findLatestPerAggregate() {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM listing_versions v " +
            "WHERE v.to_version = (SELECT MAX(x.to_version) FROM listing_versions x " +
            "                      WHERE x.aggregate_id = v.aggregate_id) " +
            "ORDER BY v.aggregate_id",
            versionRowMapper()
        );
    }

    private RowMapper<ListingVersion> versionRowMapper() {
        return (rs, rowNum) -> new ListingVersion(
            rs.getLong("id"),
            rs.getObject("aggregate_id", UUID.class),
            rs.getLong("from_version"),
            rs.getLong("to_version"),
            MutationOperation.valueOf(rs.getString("operation")),
            fromDb(rs, "applied_at"),
            rs.getString("snapshot"),
            rs.getString("source_event_id")
        );
    }
}
