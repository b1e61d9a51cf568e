package com.flagship.event_ledger.listing;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of the append-only listing version log.
 * {@code snapshot} is the JSON form of the listing after the change.
 */
@Value
public class ListingVersion {
    Long id;
    UUID aggregateId;
    long fromVersion;
    long toVersion;
    MutationOperation operation;
    Instant appliedAt;
    String snapshot;
    String sourceEventId;

    public static ListingVersion record(Listing after, MutationOperation operation,
                                        String snapshot, String sourceEventId) {
        return new ListingVersion(
            null,  // assigned by the database
            after.getId(),
            after.getVersion() - 1,
            after.getVersion(),
            operation,
            after.getUpdatedAt(),
            snapshot,
            sourceEventId
        );
    }
}
