package com.flagship.event_ledger.observability;

import com.flagship.event_ledger.ingestion.IngestionResult;
import com.flagship.event_ledger.listing.MutationOperation;
import com.flagship.event_ledger.reconciliation.InconsistencyKind;
import com.flagship.event_ledger.reconciliation.ReportStatus;
import com.flagship.event_ledger.reconciliation.ReportType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the ingestion → write model → read model → reconciliation pipeline.
 *
 * Metrics exposed:
 * - ingestion.events: Counter of ingested events by type and result
 * - ingestion.duration: Timer around a single ingest
 * - ingestion.listener.messages: Counter of stream messages forwarded by the listener
 * - write_model.mutations / write_model.conflicts: Counters by operation
 * - materialized_view.refresh: Timer by scope (full, targeted, rebuild) and outcome
 * - reconciliation.runs: Timer by report type and status
 * - reconciliation.inconsistencies: Counter by kind
 * - wagering.settlements: Counter by outcome
 */
@Component
public class PipelineMetrics {

    private final MeterRegistry registry;

    private final Timer ingestionTimer;
    private final Counter listenerMessages;
    private final Counter listenerReconnects;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.ingestionTimer = Timer.builder("ingestion.duration")
                .description("Time taken to ingest one raw event")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.listenerMessages = Counter.builder("ingestion.listener.messages")
                .description("Stream messages forwarded by the chain listener")
                .register(registry);

        this.listenerReconnects = Counter.builder("ingestion.listener.reconnects")
                .description("Stream reconnect attempts after transport errors")
                .register(registry);
    }

    // ==================== Ingestion ====================

    public void recordIngestion(String eventType, IngestionResult result, Duration duration) {
        registry.counter("ingestion.events",
                "event_type", sanitizeTag(eventType),
                "result", result.name().toLowerCase()
        ).increment();
        ingestionTimer.record(duration);
    }

    public void recordListenerMessage() {
        listenerMessages.increment();
    }

    public void recordListenerReconnect() {
        listenerReconnects.increment();
    }

    public void recordDedupCache(boolean hit) {
        registry.counter("ingestion.dedup_cache", "result", hit ? "hit" : "miss").increment();
    }

    // ==================== Write model ====================

    public void recordMutationApplied(MutationOperation operation) {
        registry.counter("write_model.mutations",
                "operation", operation.name().toLowerCase()
        ).increment();
    }

    public void recordConflict(MutationOperation operation) {
        registry.counter("write_model.conflicts",
                "operation", operation.name().toLowerCase()
        ).increment();
    }

    // ==================== Read model ====================

    public void recordViewRefresh(String scope, boolean success, Duration duration) {
        registry.timer("materialized_view.refresh",
                "scope", scope,
                "outcome", success ? "success" : "failure"
        ).record(duration);
    }

    // ==================== Reconciliation ====================

    public void recordReconciliationRun(ReportType type, ReportStatus status, Duration duration) {
        registry.timer("reconciliation.runs",
                "type", type.name().toLowerCase(),
                "status", status.name().toLowerCase()
        ).record(duration);
    }

    public void recordInconsistencies(InconsistencyKind kind, int count) {
        if (count <= 0) {
            return;
        }
        registry.counter("reconciliation.inconsistencies",
                "kind", kind.name().toLowerCase()
        ).increment(count);
    }

    // ==================== Wagering ====================

    public void recordSettlement(String outcome) {
        registry.counter("wagering.settlements", "outcome", sanitizeTag(outcome)).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_.]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
