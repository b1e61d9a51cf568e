package com.flagship.event_ledger.listing;

import lombok.Getter;

import java.util.UUID;

/**
 * A write was attempted against a version of the listing that is no longer current.
 */
@Getter
public class ConcurrencyConflictException extends RuntimeException {

    private final UUID aggregateId;
    private final long expectedVersion;

    /** Current version, or null when a racing writer's version could not be read. */
    private final Long actualVersion;

    public ConcurrencyConflictException(UUID aggregateId, long expectedVersion, Long actualVersion) {
        super(String.format("Version conflict on listing %s: expected %d, actual %s",
                aggregateId, expectedVersion, actualVersion != null ? actualVersion : "unknown"));
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
