package com.flagship.event_ledger.ingestion;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One event as received from the chain, before any domain interpretation.
 * Also the wire format of the raw-events Kafka topic.
 */
@Value
@Builder
@Jacksonized
public class RawEvent {
    /** Source-assigned identity; the deduplication key. */
    String eventId;
    String contract;
    String type;
    /** Opaque JSON, decoded by the mutation handler registered for {@link #type}. */
    String payload;
    long blockNumber;
    Instant timestamp;

    /**
     * @throws IllegalArgumentException naming the first missing or invalid field
     */
    public void validate() {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Raw event is missing eventId");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Raw event " + eventId + " is missing type");
        }
        if (contract == null || contract.isBlank()) {
            throw new IllegalArgumentException("Raw event " + eventId + " is missing contract");
        }
        if (blockNumber < 0) {
            throw new IllegalArgumentException("Raw event " + eventId + " has negative blockNumber " + blockNumber);
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Raw event " + eventId + " is missing timestamp");
        }
    }
}
