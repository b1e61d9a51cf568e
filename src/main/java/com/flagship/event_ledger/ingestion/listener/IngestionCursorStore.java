package com.flagship.event_ledger.ingestion.listener;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.Optional;

import static com.flagship.event_ledger.common.JdbcTimestamps.toDb;

/**
 * Last forwarded paging token per stream. A single listener writes each stream.
 */
@Repository
public class IngestionCursorStore {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public IngestionCursorStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    public Optional<String> load(String streamName) {
        return jdbcTemplate.queryForList(
                "SELECT cursor_value FROM ingestion_cursors WHERE stream_name = ?", String.class, streamName)
            .stream().findFirst();
    }

    public void save(String streamName, String cursor) {
        int updated = jdbcTemplate.update(
            "UPDATE ingestion_cursors SET cursor_value = ?, updated_at = ? WHERE stream_name = ?",
            cursor, toDb(clock.instant()), streamName);
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO ingestion_cursors (stream_name, cursor_value, updated_at) VALUES (?, ?, ?)",
                streamName, cursor, toDb(clock.instant()));
        }
    }
}
