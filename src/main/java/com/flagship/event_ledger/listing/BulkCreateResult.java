package com.flagship.event_ledger.listing;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Per-item outcome of a bulk create. Items are independent: one conflict or
 * invalid item never undoes the others.
 */
@Value
@Builder
public class BulkCreateResult {
    @Singular
    List<UUID> createdIds;
    @Singular
    List<ItemFailure> conflicts;
    @Singular
    List<ItemFailure> failures;

    public int getRequested() {
        return createdIds.size() + conflicts.size() + failures.size();
    }

    public boolean isFullySuccessful() {
        return conflicts.isEmpty() && failures.isEmpty();
    }

    @Value
    public static class ItemFailure {
        UUID id;
        String reason;
    }
}
