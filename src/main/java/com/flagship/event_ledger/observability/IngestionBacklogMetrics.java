package com.flagship.event_ledger.observability;

import com.flagship.event_ledger.config.IngestionProperties;
import com.flagship.event_ledger.ingestion.RawEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges over the raw event backlog, refreshed by {@link MetricsScheduler}.
 */
@Component
@Slf4j
public class IngestionBacklogMetrics {

    private final RawEventRepository rawEventRepository;
    private final MeterRegistry meterRegistry;
    private final IngestionProperties properties;
    private final Clock clock;

    private final AtomicLong unprocessed = new AtomicLong(0);
    private final AtomicLong oldestUnprocessedAgeSeconds = new AtomicLong(0);
    private final AtomicLong exhausted = new AtomicLong(0);

    public IngestionBacklogMetrics(RawEventRepository rawEventRepository,
                                   MeterRegistry meterRegistry,
                                   IngestionProperties properties,
                                   Clock clock) {
        this.rawEventRepository = rawEventRepository;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("ingestion.backlog.size", unprocessed, AtomicLong::get)
                .description("Raw events stored but not yet applied")
                .register(meterRegistry);

        Gauge.builder("ingestion.backlog.age.seconds", oldestUnprocessedAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unprocessed raw event in seconds")
                .register(meterRegistry);

        Gauge.builder("ingestion.events.exhausted", exhausted, AtomicLong::get)
                .description("Unprocessed raw events that reached the attempt limit")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            unprocessed.set(rawEventRepository.countByProcessedFalse());
            oldestUnprocessedAgeSeconds.set(rawEventRepository.findOldestUnprocessedReceivedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                    .orElse(0L));
            exhausted.set(rawEventRepository.countByProcessedFalseAndAttemptsGreaterThanEqual(
                    properties.getReprocessing().getMaxAttempts()));
        } catch (Exception e) {
            log.warn("Failed to refresh ingestion metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return unprocessed.get();
    }

    public long getExhaustedCount() {
        return exhausted.get();
    }
}
