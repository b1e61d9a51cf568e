package com.flagship.event_ledger.readmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.event_ledger.common.UnitOfWork;
import com.flagship.event_ledger.listing.Listing;
import com.flagship.event_ledger.listing.ListingVersion;
import com.flagship.event_ledger.listing.ListingVersionRepository;
import com.flagship.event_ledger.observability.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Rebuilds the read model from the version log.
 *
 * The latest snapshot of every aggregate is re-projected in bounded batches, each
 * in its own unit of work, then a full refresh recomputes the counters. Ongoing
 * writes keep working: a row projected from a newer version meanwhile is
 * overwritten only by that same or a newer snapshot in the next write.
 */
@Service
@Slf4j
public class ReadModelRebuildService {

    static final int BATCH_SIZE = 200;

    private final ListingVersionRepository versionRepository;
    private final ListingProjectionRepository projectionRepository;
    private final MaterializedViewService materializedViewService;
    private final UnitOfWork unitOfWork;
    private final ObjectMapper objectMapper;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public ReadModelRebuildService(ListingVersionRepository versionRepository,
                                   ListingProjectionRepository projectionRepository,
                                   MaterializedViewService materializedViewService,
                                   UnitOfWork unitOfWork,
                                   ObjectMapper objectMapper,
                                   PipelineMetrics metrics,
                                   Clock clock) {
        this.versionRepository = versionRepository;
        this.projectionRepository = projectionRepository;
        this.materializedViewService = materializedViewService;
        this.unitOfWork = unitOfWork;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @return number of aggregates re-projected
     */
    public int rebuildFromVersionLog() {
        long start = System.nanoTime();
        boolean success = false;
        log.info("Starting read-model rebuild from version log");
        try {
            List<ListingVersion> latest = versionRepository.findLatestPerAggregate();
            for (int from = 0; from < latest.size(); from += BATCH_SIZE) {
                List<ListingVersion> batch = latest.subList(from, Math.min(from + BATCH_SIZE, latest.size()));
                unitOfWork.run(() -> batch.forEach(version ->
                        projectionRepository.project(fromSnapshot(version), clock.instant(), true)));
            }
            materializedViewService.refreshAll();
            success = true;
            log.info("Read-model rebuild completed: {} aggregates", latest.size());
            return latest.size();
        } finally {
            metrics.recordViewRefresh("rebuild", success, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private Listing fromSnapshot(ListingVersion version) {
        try {
            return objectMapper.readValue(version.getSnapshot(), Listing.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(String.format(
                "Unreadable snapshot for listing %s version %d", version.getAggregateId(), version.getToVersion()), e);
        }
    }
}
