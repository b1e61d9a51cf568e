package com.flagship.event_ledger.support;

import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * Empties every table between integration tests, children before parents.
 */
public final class TestDatabase {

    private static final List<String> TABLES = List.of(
            "reconciliation_inconsistencies",
            "reconciliation_reports",
            "settlements",
            "bets",
            "ledger_entries",
            "ledger_transactions",
            "accounts",
            "event_feedback",
            "attendances",
            "registrations",
            "outbox_events",
            "listings_read",
            "listing_versions",
            "listings",
            "raw_events",
            "ingestion_cursors");

    private TestDatabase() {
    }

    public static void clean(JdbcTemplate jdbcTemplate) {
        TABLES.forEach(table -> jdbcTemplate.update("DELETE FROM " + table));
    }
}
