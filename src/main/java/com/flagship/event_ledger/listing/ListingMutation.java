package com.flagship.event_ledger.listing;

import lombok.Value;

/**
 * A requested change to one listing, optionally tagged with the raw event that caused it.
 */
@Value
public class ListingMutation {
    MutationOperation operation;
    ListingDraft draft;
    String sourceEventId;

    public static ListingMutation create(ListingDraft draft) {
        return new ListingMutation(MutationOperation.CREATE, draft, null);
    }

    public static ListingMutation update(ListingDraft changes) {
        return new ListingMutation(MutationOperation.UPDATE, changes, null);
    }

    public static ListingMutation delete() {
        return new ListingMutation(MutationOperation.DELETE, null, null);
    }

    static ListingMutation bulkCreate(ListingDraft draft, String sourceEventId) {
        return new ListingMutation(MutationOperation.BULK_CREATE, draft, sourceEventId);
    }

    public ListingMutation causedBy(String eventId) {
        return new ListingMutation(operation, draft, eventId);
    }
}
