package com.flagship.event_ledger.reconciliation;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * JPA entity for reconciliation reports. Summary counts are denormalized into
 * columns so listing reports does not load their inconsistencies.
 */
@Entity
@Table(name = "reconciliation_reports")
@Getter
@Setter
@NoArgsConstructor
public class ReconciliationReportEntity {

    @Id
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "report_type", nullable = false, length = 20)
    private ReportType reportType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReportStatus status;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "negative_balance_count", nullable = false)
    private int negativeBalanceCount;

    @Column(name = "orphaned_bet_count", nullable = false)
    private int orphanedBetCount;

    @Column(name = "mismatched_settlement_count", nullable = false)
    private int mismatchedSettlementCount;

    @Column(name = "stuck_settlement_count", nullable = false)
    private int stuckSettlementCount;

    @Column(name = "total_inconsistencies", nullable = false)
    private int totalInconsistencies;

    @Column(name = "failed_rules", length = 500)
    private String failedRules;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @OneToMany(mappedBy = "report", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("position ASC")
    private List<InconsistencyEntity> inconsistencies = new ArrayList<>();

    public static ReconciliationReportEntity started(UUID id, ReportType type, Instant startedAt) {
        ReconciliationReportEntity entity = new ReconciliationReportEntity();
        entity.id = id;
        entity.reportType = type;
        entity.status = ReportStatus.RUNNING;
        entity.startedAt = startedAt;
        return entity;
    }

    /**
     * Writes the final state of {@code report} into this entity.
     */
    public void complete(ReconciliationReport report, Function<Map<String, Object>, String> detailsWriter) {
        this.status = report.getStatus();
        this.completedAt = report.getCompletedAt();
        Map<InconsistencyKind, Integer> counts = report.getCounts();
        this.negativeBalanceCount = counts.get(InconsistencyKind.NEGATIVE_BALANCE);
        this.orphanedBetCount = counts.get(InconsistencyKind.ORPHANED_BET);
        this.mismatchedSettlementCount = counts.get(InconsistencyKind.MISMATCHED_SETTLEMENT);
        this.stuckSettlementCount = counts.get(InconsistencyKind.STUCK_SETTLEMENT);
        this.totalInconsistencies = report.getTotalInconsistencies();
        this.failedRules = report.getFailedRules().isEmpty() ? null : String.join(",", report.getFailedRules());
        this.errorMessage = report.getErrorMessage();

        this.inconsistencies.clear();
        int position = 0;
        for (Inconsistency inconsistency : report.getInconsistencies()) {
            this.inconsistencies.add(InconsistencyEntity.of(
                    this, inconsistency, detailsWriter.apply(inconsistency.getDetails()), position++));
        }
    }

    /**
     * Closes a run whose results could not be written.
     */
    public void fail(String message, Instant at) {
        this.status = ReportStatus.FAILED;
        this.completedAt = at;
        this.errorMessage = message;
    }

    public List<String> failedRuleNames() {
        return failedRules == null || failedRules.isBlank() ? List.of() : Arrays.asList(failedRules.split(","));
    }
}
