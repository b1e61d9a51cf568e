package com.flagship.event_ledger.listing;

import lombok.Value;

import java.util.UUID;

@Value
public class BulkCreateItem {
    UUID id;
    ListingDraft draft;
}
