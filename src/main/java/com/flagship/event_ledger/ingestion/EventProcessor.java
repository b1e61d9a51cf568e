package com.flagship.event_ledger.ingestion;

import com.flagship.event_ledger.common.StorageFailureException;
import com.flagship.event_ledger.common.UnitOfWork;
import com.flagship.event_ledger.config.IngestionProperties;
import com.flagship.event_ledger.observability.CorrelationContext;
import com.flagship.event_ledger.observability.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Applies raw chain events to the domain exactly once per eventId.
 *
 * Processing of one event:
 * 1. Redis fast path: a cached id is a duplicate
 * 2. The raw event is stored in its own transaction (the unique eventId constraint
 *    collapses concurrent deliveries onto one row)
 * 3. In a second transaction the row is locked, re-checked, the registered mutation
 *    applied and the row marked processed. Mutation and processed flag commit together,
 *    so a crash in between can only lead to a retry, never to a double apply
 * 4. On failure the mutation is rolled back and attempts/lastError are recorded in a
 *    third transaction; {@link #reprocessPending()} picks the event up later
 *
 * Storage failures while storing the raw event propagate to the caller so the
 * listener or Kafka consumer redelivers.
 */
@Service
@Slf4j
public class EventProcessor {

    private final RawEventRepository repository;
    private final EventMutationRegistry registry;
    private final ProcessedEventCache dedupCache;
    private final UnitOfWork unitOfWork;
    private final PipelineMetrics metrics;
    private final IngestionProperties properties;
    private final Clock clock;

    public EventProcessor(RawEventRepository repository,
                          EventMutationRegistry registry,
                          ProcessedEventCache dedupCache,
                          UnitOfWork unitOfWork,
                          PipelineMetrics metrics,
                          IngestionProperties properties,
                          Clock clock) {
        this.repository = repository;
        this.registry = registry;
        this.dedupCache = dedupCache;
        this.unitOfWork = unitOfWork;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Ingests one raw event.
     *
     * @return the outcome; duplicates are a successful no-op
     * @throws IllegalArgumentException if required fields are missing
     * @throws StorageFailureException if the raw event could not be stored
     */
    public IngestionResult ingest(RawEvent event) {
        event.validate();
        long start = System.nanoTime();
        IngestionResult result = IngestionResult.FAILED;
        CorrelationContext.enterEvent(event.getEventId());
        try {
            if (dedupCache.isProcessed(event.getEventId())) {
                log.debug("Event {} found in dedup cache, skipping", event.getEventId());
                result = IngestionResult.DUPLICATE;
                return result;
            }
            storeIfAbsent(event);
            result = applyStored(event.getEventId());
            return result;
        } finally {
            metrics.recordIngestion(event.getType(), result, Duration.ofNanos(System.nanoTime() - start));
            CorrelationContext.clear();
        }
    }

    /**
     * Retries unprocessed events in block order, a bounded batch at a time.
     *
     * @return number of events that left the unprocessed state
     */
    public int reprocessPending() {
        IngestionProperties.Reprocessing config = properties.getReprocessing();
        List<String> pending = repository.findPendingEventIds(
                config.getMaxAttempts(), PageRequest.of(0, config.getBatchSize()));
        if (pending.isEmpty()) {
            return 0;
        }

        log.info("Reprocessing {} unprocessed raw events", pending.size());
        int completed = 0;
        for (String eventId : pending) {
            CorrelationContext.enterEvent(eventId);
            try {
                IngestionResult result = applyStored(eventId);
                if (result != IngestionResult.FAILED) {
                    completed++;
                }
            } finally {
                CorrelationContext.clear();
            }
        }
        log.info("Reprocessing finished: {}/{} events completed", completed, pending.size());
        return completed;
    }

    public long countUnprocessed() {
        return repository.countByProcessedFalse();
    }

    private void storeIfAbsent(RawEvent event) {
        try {
            unitOfWork.run(() -> {
                if (repository.findByEventId(event.getEventId()).isEmpty()) {
                    repository.saveAndFlush(RawEventEntity.received(event, clock.instant()));
                }
            });
        } catch (StorageFailureException e) {
            if (!(e.getCause() instanceof DataIntegrityViolationException)) {
                throw e;
            }
            log.debug("Event {} was stored concurrently by another worker", event.getEventId());
        }
    }

    IngestionResult applyStored(String eventId) {
        IngestionResult result;
        try {
            result = unitOfWork.execute(() -> applyLocked(eventId));
        } catch (RuntimeException e) {
            recordFailure(eventId, e);
            return IngestionResult.FAILED;
        }

        dedupCache.markProcessed(eventId);
        if (result == IngestionResult.DUPLICATE) {
            log.info("Event {} already processed, skipping", eventId);
        }
        return result;
    }

    private IngestionResult applyLocked(String eventId) {
        RawEventEntity row = repository.findByEventIdForUpdate(eventId)
                .orElseThrow(() -> new IllegalStateException("Raw event not stored: " + eventId));
        if (row.isProcessed()) {
            return IngestionResult.DUPLICATE;
        }

        Optional<EventMutationHandler> handler = registry.find(row.getEventType());
        if (handler.isEmpty()) {
            row.markProcessed(clock.instant());
            log.info("No mutation registered for type {}, event {} marked processed",
                    row.getEventType(), eventId);
            return IngestionResult.SKIPPED;
        }

        handler.get().apply(row.toRawEvent());
        row.markProcessed(clock.instant());
        log.info("Applied event {} (type={}, block={})", eventId, row.getEventType(), row.getBlockNumber());
        return IngestionResult.APPLIED;
    }

    private void recordFailure(String eventId, RuntimeException cause) {
        String error = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        log.error("Failed to apply event {}: {}", eventId, error, cause);
        try {
            unitOfWork.run(() -> repository.findByEventId(eventId)
                    .ifPresent(row -> row.recordFailure(error)));
        } catch (RuntimeException e) {
            log.error("Could not record failure for event {}", eventId, e);
        }
    }
}
