package com.flagship.event_ledger.listing;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Outbox payload published to the listing-changes topic for every version-log entry.
 */
@Value
public class ListingChangedEvent {
    UUID eventId;
    UUID listingId;
    String eventType;
    MutationOperation operation;
    long fromVersion;
    long toVersion;
    String title;
    ListingStatus status;
    boolean deleted;
    String sourceEventId;
    Instant occurredAt;

    public static String eventTypeFor(MutationOperation operation) {
        return switch (operation) {
            case CREATE, BULK_CREATE -> "ListingCreated";
            case UPDATE -> "ListingUpdated";
            case DELETE -> "ListingDeleted";
        };
    }

    public static ListingChangedEvent from(Listing listing, MutationOperation operation, String sourceEventId) {
        return new ListingChangedEvent(
            UUID.randomUUID(),
            listing.getId(),
            eventTypeFor(operation),
            operation,
            listing.getVersion() - 1,
            listing.getVersion(),
            listing.getTitle(),
            listing.getStatus(),
            listing.isDeleted(),
            sourceEventId,
            listing.getUpdatedAt()
        );
    }
}
