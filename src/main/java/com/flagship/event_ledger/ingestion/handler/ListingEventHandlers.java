package com.flagship.event_ledger.ingestion.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.event_ledger.ingestion.RawEvent;
import com.flagship.event_ledger.listing.BulkCreateItem;
import com.flagship.event_ledger.listing.BulkCreateResult;
import com.flagship.event_ledger.listing.ConcurrencyControlService;
import com.flagship.event_ledger.listing.Listing;
import com.flagship.event_ledger.listing.ListingDraft;
import com.flagship.event_ledger.listing.ListingMutation;
import com.flagship.event_ledger.listing.ListingNotFoundException;
import com.flagship.event_ledger.listing.ListingStatus;
import com.flagship.event_ledger.wagering.WageringService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Listing lifecycle events. Updates and deletes carry an optional
 * {@code expectedVersion}; without one the current version is used, since
 * chain order already serializes them.
 */
@Component
@Slf4j
public class ListingEventHandlers {

    private final ConcurrencyControlService concurrencyControl;
    private final WageringService wageringService;
    private final ObjectMapper objectMapper;

    public ListingEventHandlers(ConcurrencyControlService concurrencyControl,
                                WageringService wageringService,
                                ObjectMapper objectMapper) {
        this.concurrencyControl = concurrencyControl;
        this.wageringService = wageringService;
        this.objectMapper = objectMapper;
    }

    public void onCreated(RawEvent event) {
        PayloadReader payload = PayloadReader.of(event, objectMapper);
        concurrencyControl.applyMutation(payload.uuid("listingId"), 0L,
                ListingMutation.create(draft(payload)).causedBy(event.getEventId()));
    }

    public void onUpdated(RawEvent event) {
        PayloadReader payload = PayloadReader.of(event, objectMapper);
        UUID id = payload.uuid("listingId");
        concurrencyControl.applyMutation(id, expectedVersion(payload, id),
                ListingMutation.update(draft(payload)).causedBy(event.getEventId()));
    }

    /**
     * Soft-deletes the listing and voids its open bets in the same transaction.
     */
    public void onDeleted(RawEvent event) {
        PayloadReader payload = PayloadReader.of(event, objectMapper);
        UUID id = payload.uuid("listingId");
        concurrencyControl.applyMutation(id, expectedVersion(payload, id),
                ListingMutation.delete().causedBy(event.getEventId()));
        wageringService.voidOpenBets(id);
    }

    public void onBulkCreated(RawEvent event) {
        PayloadReader payload = PayloadReader.of(event, objectMapper);
        JsonNode listings = payload.node("listings");
        if (listings == null || !listings.isArray()) {
            throw new IllegalArgumentException("Payload of event " + event.getEventId() + " is missing listings");
        }
        List<BulkCreateItem> items = new ArrayList<>();
        for (JsonNode node : listings) {
            PayloadReader item = payload.child(node);
            items.add(new BulkCreateItem(item.uuid("listingId"), draft(item)));
        }
        BulkCreateResult result = concurrencyControl.bulkCreate(items, event.getEventId());
        if (!result.isFullySuccessful()) {
            log.warn("Bulk create from event {} partially applied: conflicts={}, failures={}",
                    event.getEventId(), result.getConflicts(), result.getFailures());
        }
    }

    private long expectedVersion(PayloadReader payload, UUID id) {
        return payload.optionalLong("expectedVersion").orElseGet(() -> concurrencyControl.getListing(id)
                .map(Listing::getVersion)
                .orElseThrow(() -> new ListingNotFoundException(id)));
    }

    private ListingDraft draft(PayloadReader payload) {
        return ListingDraft.builder()
                .title(payload.optionalText("title").orElse(null))
                .organizerId(payload.optionalText("organizerId").orElse(null))
                .organizerName(payload.optionalText("organizerName").orElse(null))
                .capacity(payload.optionalInt("capacity").orElse(null))
                .status(payload.optionalEnum("status", ListingStatus.class).orElse(null))
                .startDate(payload.optionalInstant("startDate").orElse(null))
                .endDate(payload.optionalInstant("endDate").orElse(null))
                .build();
    }
}
