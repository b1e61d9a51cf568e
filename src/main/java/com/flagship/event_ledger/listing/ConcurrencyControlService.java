package com.flagship.event_ledger.listing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.event_ledger.common.UnitOfWork;
import com.flagship.event_ledger.observability.CorrelationContext;
import com.flagship.event_ledger.observability.PipelineMetrics;
import com.flagship.event_ledger.outbox.OutboxService;
import com.flagship.event_ledger.readmodel.MaterializedViewService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The only writer of the listing write model.
 *
 * Every accepted mutation, in one transaction:
 * 1. Checks the caller's expected version against the stored one
 * 2. Writes the new state at version + 1
 * 3. Appends the version log entry (with the post-change snapshot)
 * 4. Appends a ListingCreated/Updated/Deleted event to the outbox
 * 5. Projects the descriptive fields into the read model
 *
 * Three guards stop a stale writer: the row lock taken before the version check,
 * the conditional update on the version column, and the unique
 * (aggregate_id, to_version) constraint on the version log. Whichever trips, the
 * caller sees a {@link ConcurrencyConflictException} and nothing is written.
 */
@Service
@Slf4j
public class ConcurrencyControlService {

    static final String AGGREGATE_TYPE = "Listing";

    private final ListingRepository listingRepository;
    private final ListingVersionRepository versionRepository;
    private final OutboxService outboxService;
    private final MaterializedViewService materializedViewService;
    private final UnitOfWork unitOfWork;
    private final ObjectMapper objectMapper;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public ConcurrencyControlService(ListingRepository listingRepository,
                                     ListingVersionRepository versionRepository,
                                     OutboxService outboxService,
                                     MaterializedViewService materializedViewService,
                                     UnitOfWork unitOfWork,
                                     ObjectMapper objectMapper,
                                     PipelineMetrics metrics,
                                     Clock clock) {
        this.listingRepository = listingRepository;
        this.versionRepository = versionRepository;
        this.outboxService = outboxService;
        this.materializedViewService = materializedViewService;
        this.unitOfWork = unitOfWork;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Applies one mutation to a listing.
     *
     * @param expectedVersion 0 for a create, otherwise the version the caller last saw
     * @return the listing after the change
     * @throws ConcurrencyConflictException if the stored version is not {@code expectedVersion}
     * @throws ListingNotFoundException if an update or delete targets a missing listing
     * @throws IllegalArgumentException if the mutation is invalid
     * @throws IllegalStateException if the listing is deleted
     */
    @Transactional
    public Listing applyMutation(UUID aggregateId, long expectedVersion, ListingMutation mutation) {
        return doApply(aggregateId, expectedVersion, mutation);
    }

    /**
     * Creates each item in its own transaction. A conflict or invalid item is
     * reported and the remaining items are still applied.
     */
    public BulkCreateResult bulkCreate(List<BulkCreateItem> items, String sourceEventId) {
        BulkCreateResult.BulkCreateResultBuilder result = BulkCreateResult.builder();
        for (BulkCreateItem item : items) {
            UUID id = item.getId();
            try {
                unitOfWork.execute(() -> doApply(id, 0L, ListingMutation.bulkCreate(item.getDraft(), sourceEventId)));
                result.createdId(id);
            } catch (ConcurrencyConflictException e) {
                result.conflict(new BulkCreateResult.ItemFailure(id, e.getMessage()));
            } catch (RuntimeException e) {
                log.warn("Bulk create item {} failed: {}", id, e.getMessage());
                result.failure(new BulkCreateResult.ItemFailure(id, e.getMessage()));
            }
        }
        BulkCreateResult outcome = result.build();
        log.info("Bulk create finished: requested={}, created={}, conflicts={}, failures={}",
                outcome.getRequested(), outcome.getCreatedIds().size(),
                outcome.getConflicts().size(), outcome.getFailures().size());
        return outcome;
    }

    @Transactional(readOnly = true)
    public Optional<Listing> getListing(UUID id) {
        return listingRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public List<ListingVersion> getHistory(UUID id) {
        return versionRepository.findByAggregateId(id);
    }

    private Listing doApply(UUID aggregateId, long expectedVersion, ListingMutation mutation) {
        MutationOperation operation = mutation.getOperation();
        MDC.put(CorrelationContext.AGGREGATE_ID_MDC_KEY, aggregateId.toString());
        try {
            Listing after = operation.isCreate()
                    ? insertNew(aggregateId, expectedVersion, mutation)
                    : updateExisting(aggregateId, expectedVersion, mutation);

            versionRepository.append(ListingVersion.record(
                    after, operation, snapshot(after), mutation.getSourceEventId()));
            outboxService.append(AGGREGATE_TYPE, aggregateId, ListingChangedEvent.eventTypeFor(operation),
                    ListingChangedEvent.from(after, operation, mutation.getSourceEventId()));
            materializedViewService.project(after);

            metrics.recordMutationApplied(operation);
            log.info("Applied {} to listing: version {} -> {}", operation, expectedVersion, after.getVersion());
            return after;
        } catch (DuplicateKeyException | ConcurrencyFailureException e) {
            metrics.recordConflict(operation);
            log.warn("Concurrent writer won on listing {} at version {}", aggregateId, expectedVersion);
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, null);
        } catch (ConcurrencyConflictException e) {
            metrics.recordConflict(operation);
            log.warn("Version conflict on listing: expected={}, actual={}", expectedVersion, e.getActualVersion());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.AGGREGATE_ID_MDC_KEY);
        }
    }

    private Listing insertNew(UUID aggregateId, long expectedVersion, ListingMutation mutation) {
        Optional<Long> existing = listingRepository.findVersion(aggregateId);
        if (expectedVersion != 0 || existing.isPresent()) {
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, existing.orElse(0L));
        }
        Listing created = Listing.create(aggregateId, mutation.getDraft(), clock.instant());
        listingRepository.insert(created);
        return created;
    }

    private Listing updateExisting(UUID aggregateId, long expectedVersion, ListingMutation mutation) {
        Listing current = listingRepository.findByIdForUpdate(aggregateId)
                .orElseThrow(() -> new ListingNotFoundException(aggregateId));
        if (current.getVersion() != expectedVersion) {
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, current.getVersion());
        }

        Instant now = clock.instant();
        Listing after = mutation.getOperation() == MutationOperation.DELETE
                ? current.markDeleted(now)
                : current.applyUpdate(mutation.getDraft(), now);
        if (listingRepository.updateIfVersion(after, expectedVersion) == 0) {
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, null);
        }
        return after;
    }

    private String snapshot(Listing listing) {
        try {
            return objectMapper.writeValueAsString(listing);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize listing snapshot " + listing.getId(), e);
        }
    }
}
