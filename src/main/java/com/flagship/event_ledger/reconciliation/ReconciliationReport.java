package com.flagship.event_ledger.reconciliation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of one reconciliation run. Inconsistencies keep the order the rules found them in.
 */
@Value
@Builder(toBuilder = true)
public class ReconciliationReport {
    UUID id;
    ReportType type;
    ReportStatus status;
    Instant startedAt;
    Instant completedAt;
    @Singular
    List<Inconsistency> inconsistencies;
    @Singular
    List<String> failedRules;
    String errorMessage;

    public Map<InconsistencyKind, Integer> getCounts() {
        Map<InconsistencyKind, Integer> counts = new EnumMap<>(InconsistencyKind.class);
        for (InconsistencyKind kind : InconsistencyKind.values()) {
            counts.put(kind, 0);
        }
        inconsistencies.forEach(i -> counts.merge(i.getKind(), 1, Integer::sum));
        return counts;
    }

    public int getTotalInconsistencies() {
        return inconsistencies.size();
    }
}
