package com.flagship.event_ledger.ingestion;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Stored raw event. Created on first receipt, flipped to processed exactly once, never deleted.
 */
@Entity
@Table(name = "raw_events")
@Getter
@Setter
@NoArgsConstructor
public class RawEventEntity {

    private static final int MAX_ERROR_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "event_id", nullable = false, unique = true, updatable = false, length = 128)
    private String eventId;

    @Column(name = "contract", nullable = false, updatable = false, length = 128)
    private String contract;

    @Column(name = "event_type", nullable = false, updatable = false, length = 100)
    private String eventType;

    @Column(name = "payload", updatable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "block_number", nullable = false, updatable = false)
    private long blockNumber;

    @Column(name = "event_timestamp", nullable = false, updatable = false)
    private Instant eventTimestamp;

    @Column(name = "processed", nullable = false)
    private boolean processed;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    public static RawEventEntity received(RawEvent event, Instant receivedAt) {
        RawEventEntity entity = new RawEventEntity();
        entity.setEventId(event.getEventId());
        entity.setContract(event.getContract());
        entity.setEventType(event.getType());
        entity.setPayload(event.getPayload());
        entity.setBlockNumber(event.getBlockNumber());
        entity.setEventTimestamp(event.getTimestamp());
        entity.setProcessed(false);
        entity.setAttempts(0);
        entity.setReceivedAt(receivedAt);
        return entity;
    }

    public RawEvent toRawEvent() {
        return RawEvent.builder()
                .eventId(eventId)
                .contract(contract)
                .type(eventType)
                .payload(payload)
                .blockNumber(blockNumber)
                .timestamp(eventTimestamp)
                .build();
    }

    public void markProcessed(Instant at) {
        if (processed) {
            throw new IllegalStateException("Raw event " + eventId + " is already processed");
        }
        this.processed = true;
        this.processedAt = at;
        this.attempts++;
        this.lastError = null;
    }

    public void recordFailure(String error) {
        this.attempts++;
        this.lastError = error != null && error.length() > MAX_ERROR_LENGTH
                ? error.substring(0, MAX_ERROR_LENGTH)
                : error;
    }
}
