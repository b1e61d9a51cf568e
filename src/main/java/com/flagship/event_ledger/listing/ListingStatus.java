package com.flagship.event_ledger.listing;

public enum ListingStatus {
    DRAFT,
    PUBLISHED,
    CANCELLED,
    COMPLETED
}
