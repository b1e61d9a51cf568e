package com.flagship.event_ledger.reconciliation;

import lombok.Value;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Counts per kind of the latest completed full report. {@code reportId} is null
 * when no full report has completed yet.
 */
@Value
public class ReportSummary {
    UUID reportId;
    ReportType type;
    ReportStatus status;
    Instant completedAt;
    Map<InconsistencyKind, Integer> counts;
    int totalInconsistencies;

    public static ReportSummary empty() {
        Map<InconsistencyKind, Integer> zero = new EnumMap<>(InconsistencyKind.class);
        for (InconsistencyKind kind : InconsistencyKind.values()) {
            zero.put(kind, 0);
        }
        return new ReportSummary(null, null, null, null, zero, 0);
    }

    public static ReportSummary of(ReconciliationReport report) {
        return new ReportSummary(report.getId(), report.getType(), report.getStatus(),
                report.getCompletedAt(), report.getCounts(), report.getTotalInconsistencies());
    }
}
