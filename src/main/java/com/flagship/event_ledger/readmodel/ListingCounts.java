package com.flagship.event_ledger.readmodel;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Cached engagement counters of one read-model row.
 */
@Value
public class ListingCounts {
    UUID listingId;
    long registeredCount;
    long attendanceCount;
    Instant lastActivityAt;

    public static ListingCounts none(UUID listingId) {
        return new ListingCounts(listingId, 0, 0, null);
    }
}
