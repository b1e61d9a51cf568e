package com.flagship.event_ledger.listing;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Business fields of a listing as carried by a create or update.
 * On update a null field means "leave unchanged".
 */
@Value
@Builder
public class ListingDraft {
    String title;
    String organizerId;
    String organizerName;
    Integer capacity;
    ListingStatus status;
    Instant startDate;
    Instant endDate;
}
