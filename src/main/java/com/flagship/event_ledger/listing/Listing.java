package com.flagship.event_ledger.listing;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Listing aggregate as held in the write model.
 *
 * Key principles:
 * - Immutable: every change produces a new instance with version + 1
 * - A freshly created listing is at version 1
 * - Deleted listings are kept (soft delete) and reject further changes
 *
 * The same shape is serialized into the version log as the post-change snapshot.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Listing {
    UUID id;
    String title;
    String organizerId;
    String organizerName;
    int capacity;
    ListingStatus status;
    Instant startDate;
    Instant endDate;
    boolean deleted;
    long version;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new listing at version 1. Status defaults to DRAFT.
     *
     * @throws IllegalArgumentException if required fields are missing or invalid
     */
    public static Listing create(UUID id, ListingDraft draft, Instant now) {
        if (id == null) {
            throw new IllegalArgumentException("Listing id is required");
        }
        if (draft == null) {
            throw new IllegalArgumentException("Listing fields are required for create");
        }
        Listing listing = Listing.builder()
                .id(id)
                .title(draft.getTitle())
                .organizerId(draft.getOrganizerId())
                .organizerName(draft.getOrganizerName())
                .capacity(draft.getCapacity() != null ? draft.getCapacity() : 0)
                .status(draft.getStatus() != null ? draft.getStatus() : ListingStatus.DRAFT)
                .startDate(draft.getStartDate())
                .endDate(draft.getEndDate())
                .deleted(false)
                .version(1L)
                .createdAt(now)
                .updatedAt(now)
                .build();
        listing.validate();
        return listing;
    }

    /**
     * Applies the non-null fields of {@code changes}.
     *
     * @throws IllegalStateException if the listing is deleted
     */
    public Listing applyUpdate(ListingDraft changes, Instant now) {
        if (deleted) {
            throw new IllegalStateException("Listing " + id + " is deleted and cannot be updated");
        }
        if (changes == null) {
            throw new IllegalArgumentException("Listing fields are required for update");
        }
        Listing updated = toBuilder()
                .title(changes.getTitle() != null ? changes.getTitle() : title)
                .organizerId(changes.getOrganizerId() != null ? changes.getOrganizerId() : organizerId)
                .organizerName(changes.getOrganizerName() != null ? changes.getOrganizerName() : organizerName)
                .capacity(changes.getCapacity() != null ? changes.getCapacity() : capacity)
                .status(changes.getStatus() != null ? changes.getStatus() : status)
                .startDate(changes.getStartDate() != null ? changes.getStartDate() : startDate)
                .endDate(changes.getEndDate() != null ? changes.getEndDate() : endDate)
                .version(version + 1)
                .updatedAt(now)
                .build();
        updated.validate();
        return updated;
    }

    /**
     * Soft-deletes the listing.
     *
     * @throws IllegalStateException if it is already deleted
     */
    public Listing markDeleted(Instant now) {
        if (deleted) {
            throw new IllegalStateException("Listing " + id + " is already deleted");
        }
        return toBuilder()
                .deleted(true)
                .version(version + 1)
                .updatedAt(now)
                .build();
    }

    private void validate() {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Listing title is required");
        }
        if (organizerId == null || organizerId.isBlank()) {
            throw new IllegalArgumentException("Listing organizerId is required");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Listing capacity must be positive: " + capacity);
        }
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("Listing endDate is before startDate");
        }
    }
}
