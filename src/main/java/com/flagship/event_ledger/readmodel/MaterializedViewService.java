package com.flagship.event_ledger.readmodel;

import com.flagship.event_ledger.common.UnitOfWork;
import com.flagship.event_ledger.config.MaterializedViewProperties;
import com.flagship.event_ledger.config.SchedulerConfig;
import com.flagship.event_ledger.listing.Listing;
import com.flagship.event_ledger.observability.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Maintains the denormalized listing read model.
 *
 * Key design decisions:
 * - Descriptive fields are projected from the write model inside the write transaction
 * - Engagement counters are recomputed from the transactional tables, never incremented
 * - Full and targeted refresh take the same row locks, so they serialize per row
 * - A full refresh is all-or-nothing; a targeted refresh failure stays local to its row
 */
@Service
@Slf4j
public class MaterializedViewService {

    public static final int MAX_TOP_LIMIT = 100;

    private final ListingProjectionRepository projectionRepository;
    private final ListingReadRepository readRepository;
    private final ActivityStatsRepository statsRepository;
    private final UnitOfWork unitOfWork;
    private final Executor refreshExecutor;
    private final MaterializedViewProperties properties;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public MaterializedViewService(ListingProjectionRepository projectionRepository,
                                   ListingReadRepository readRepository,
                                   ActivityStatsRepository statsRepository,
                                   UnitOfWork unitOfWork,
                                   @Qualifier(SchedulerConfig.VIEW_REFRESH_EXECUTOR) Executor refreshExecutor,
                                   MaterializedViewProperties properties,
                                   PipelineMetrics metrics,
                                   Clock clock) {
        this.projectionRepository = projectionRepository;
        this.readRepository = readRepository;
        this.statsRepository = statsRepository;
        this.unitOfWork = unitOfWork;
        this.refreshExecutor = refreshExecutor;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Projects the descriptive fields of {@code listing} into its read row.
     * Runs in the caller's write transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void project(Listing listing) {
        boolean written = projectionRepository.project(listing, clock.instant(), false);
        if (!written) {
            log.debug("Read row {} already projected from a newer version than {}",
                    listing.getId(), listing.getVersion());
        }
    }

    /**
     * Recomputes the counters of every non-deleted read row in one unit of work.
     *
     * @return number of rows refreshed
     * @throws com.flagship.event_ledger.common.StorageFailureException if storage fails; nothing is written
     */
    public int refreshAll() {
        long start = System.nanoTime();
        boolean success = false;
        try {
            int refreshed = unitOfWork.execute(() -> {
                List<UUID> ids = projectionRepository.lockNonDeleted();
                if (ids.isEmpty()) {
                    return 0;
                }
                Map<UUID, ListingCounts> all = statsRepository.countsForAll();
                List<ListingCounts> counts = ids.stream()
                        .map(id -> all.getOrDefault(id, ListingCounts.none(id)))
                        .toList();
                projectionRepository.updateCounts(counts, clock.instant());
                return counts.size();
            });
            success = true;
            log.info("Full read-model refresh completed: {} rows", refreshed);
            return refreshed;
        } finally {
            metrics.recordViewRefresh("full", success, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Recomputes the counters of one row in its own unit of work.
     * Failures are logged and reported as false, never thrown.
     *
     * @return true if the row was refreshed; false if it is missing, deleted or the refresh failed
     */
    public boolean refreshFor(UUID listingId) {
        long start = System.nanoTime();
        try {
            boolean refreshed = unitOfWork.execute(() -> {
                Optional<Boolean> deleted = projectionRepository.lockRow(listingId);
                if (deleted.isEmpty() || deleted.get()) {
                    return false;
                }
                projectionRepository.updateCounts(List.of(statsRepository.countsFor(listingId)), clock.instant());
                return true;
            });
            metrics.recordViewRefresh("targeted", true, Duration.ofNanos(System.nanoTime() - start));
            return refreshed;
        } catch (RuntimeException e) {
            metrics.recordViewRefresh("targeted", false, Duration.ofNanos(System.nanoTime() - start));
            log.error("Targeted refresh of listing {} failed: {}", listingId, e.getMessage(), e);
            return false;
        }
    }

    public CompletableFuture<Boolean> refreshForAsync(UUID listingId) {
        return CompletableFuture.supplyAsync(() -> refreshFor(listingId), refreshExecutor);
    }

    /**
     * Schedules a targeted refresh once the surrounding transaction commits, or
     * right away when there is none. Nothing happens on rollback.
     */
    public void refreshAfterCommit(UUID listingId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            dispatchRefresh(listingId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                dispatchRefresh(listingId);
            }
        });
    }

    @Transactional(readOnly = true)
    public Optional<ListingStatistics> getStatistics(UUID listingId) {
        return readRepository.findById(listingId).map(MaterializedViewService::toStatistics);
    }

    /**
     * Published, non-deleted listings with the most confirmed registrations.
     *
     * @throws IllegalArgumentException if limit is outside 1..100
     */
    @Transactional(readOnly = true)
    public List<ListingStatistics> getTopByRegistration(int limit) {
        if (limit < 1 || limit > MAX_TOP_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_TOP_LIMIT + ": " + limit);
        }
        return readRepository.findTopPublished(PageRequest.of(0, limit)).stream()
                .map(MaterializedViewService::toStatistics)
                .toList();
    }

    private void dispatchRefresh(UUID listingId) {
        if (properties.isAsyncRefresh()) {
            refreshForAsync(listingId);
        } else {
            refreshFor(listingId);
        }
    }

    static ListingStatistics toStatistics(ListingReadEntity row) {
        return ListingStatistics.builder()
                .id(row.getId())
                .title(row.getTitle())
                .organizerName(row.getOrganizerName())
                .status(row.getStatus())
                .capacity(row.getCapacity())
                .startDate(row.getStartDate())
                .endDate(row.getEndDate())
                .registeredCount(row.getRegisteredCount())
                .attendanceCount(row.getAttendanceCount())
                .lastActivityAt(row.getLastActivityAt())
                .registrationRate(percentage(row.getRegisteredCount(), row.getCapacity()))
                .attendanceRate(percentage(row.getAttendanceCount(), row.getRegisteredCount()))
                .sourceVersion(row.getSourceVersion())
                .refreshedAt(row.getRefreshedAt())
                .build();
    }

    static BigDecimal percentage(long numerator, long denominator) {
        if (denominator == 0) {
            return null;
        }
        return BigDecimal.valueOf(numerator)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(denominator), 2, RoundingMode.HALF_UP);
    }
}
