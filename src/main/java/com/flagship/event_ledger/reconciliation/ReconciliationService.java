package com.flagship.event_ledger.reconciliation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.event_ledger.common.UnitOfWork;
import com.flagship.event_ledger.observability.PipelineMetrics;
import com.flagship.event_ledger.reconciliation.rule.ReconciliationRule;
import com.flagship.event_ledger.reconciliation.rule.ReconciliationRuleRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs the reconciliation rules and keeps their reports.
 *
 * A run:
 * 1. Stores a RUNNING report
 * 2. Runs each rule in its own read transaction; a rule that throws is recorded in
 *    failedRules and the remaining rules still run
 * 3. Stores the findings in rule order with per-kind counts, status COMPLETED, or
 *    FAILED when any rule threw
 *
 * Completed reports are never modified.
 */
@Service
@Slf4j
public class ReconciliationService {

    public static final int MAX_PAGE_LIMIT = 100;
    private static final List<ReportType> FULL_REPORT_TYPES = List.of(ReportType.MANUAL, ReportType.SCHEDULED);
    private static final List<ReportStatus> FINISHED = List.of(ReportStatus.COMPLETED, ReportStatus.FAILED);

    private final ReconciliationRuleRegistry ruleRegistry;
    private final ReconciliationReportRepository reportRepository;
    private final UnitOfWork unitOfWork;
    private final ObjectMapper objectMapper;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public ReconciliationService(ReconciliationRuleRegistry ruleRegistry,
                                 ReconciliationReportRepository reportRepository,
                                 UnitOfWork unitOfWork,
                                 ObjectMapper objectMapper,
                                 PipelineMetrics metrics,
                                 Clock clock) {
        this.ruleRegistry = ruleRegistry;
        this.reportRepository = reportRepository;
        this.unitOfWork = unitOfWork;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs every rule and stores the report.
     *
     * @param type MANUAL or SCHEDULED
     */
    public ReconciliationReport runReconciliation(ReportType type) {
        if (type == ReportType.QUICK) {
            throw new IllegalArgumentException("Use runQuickCheck for QUICK reports");
        }
        return run(type, ruleRegistry.all());
    }

    /**
     * Runs only the negative balance rule and stores a QUICK report.
     */
    public ReconciliationReport runQuickCheck() {
        ReconciliationRule negativeBalances = ruleRegistry.all().stream()
                .filter(rule -> rule.kind() == InconsistencyKind.NEGATIVE_BALANCE)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No negative balance rule registered"));
        return run(ReportType.QUICK, List.of(negativeBalances));
    }

    /**
     * Runs one rule without storing a report.
     *
     * @throws RuleNotFoundException if no rule has this name
     * @throws RuleExecutionException if the rule fails
     */
    public List<Inconsistency> runRule(String ruleName) {
        ReconciliationRule rule = ruleRegistry.find(ruleName)
                .orElseThrow(() -> new RuleNotFoundException(ruleName));
        try {
            return unitOfWork.execute(rule::detect);
        } catch (RuntimeException e) {
            throw new RuleExecutionException(rule.name(), e);
        }
    }

    /**
     * Reports by startedAt descending.
     *
     * @param page  1-based
     * @param limit 1..100
     */
    @Transactional(readOnly = true)
    public PaginatedReports getReports(int page, int limit) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1: " + page);
        }
        if (limit < 1 || limit > MAX_PAGE_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_LIMIT + ": " + limit);
        }
        Page<ReconciliationReportEntity> result =
                reportRepository.findAllByOrderByStartedAtDesc(PageRequest.of(page - 1, limit));
        List<ReconciliationReport> data = result.getContent().stream().map(this::toDomain).toList();
        return new PaginatedReports(data, result.getTotalElements(), page, limit, result.getTotalPages());
    }

    /**
     * @throws ReportNotFoundException if there is no such report
     */
    @Transactional(readOnly = true)
    public ReconciliationReport getReportById(UUID reportId) {
        return reportRepository.findById(reportId)
                .map(this::toDomain)
                .orElseThrow(() -> new ReportNotFoundException(reportId));
    }

    /**
     * Summary of the most recent finished MANUAL or SCHEDULED report.
     */
    @Transactional(readOnly = true)
    public ReportSummary getLatestReportSummary() {
        return reportRepository.findFirstByReportTypeInAndStatusInOrderByCompletedAtDesc(FULL_REPORT_TYPES, FINISHED)
                .map(this::toDomain)
                .map(ReportSummary::of)
                .orElseGet(ReportSummary::empty);
    }

    private ReconciliationReport run(ReportType type, List<ReconciliationRule> rules) {
        UUID reportId = UUID.randomUUID();
        Instant startedAt = clock.instant();
        unitOfWork.run(() -> reportRepository.save(ReconciliationReportEntity.started(reportId, type, startedAt)));
        log.info("Reconciliation {} started: reportId={}, rules={}", type, reportId, rules.size());

        List<Inconsistency> findings = new ArrayList<>();
        List<String> failedRules = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (ReconciliationRule rule : rules) {
            try {
                List<Inconsistency> found = unitOfWork.execute(rule::detect);
                findings.addAll(found);
                metrics.recordInconsistencies(rule.kind(), found.size());
                log.info("Rule {} found {} inconsistencies", rule.name(), found.size());
            } catch (RuntimeException e) {
                RuleExecutionException failure = new RuleExecutionException(rule.name(), e);
                failedRules.add(rule.name());
                errors.add(failure.getMessage());
                log.error(failure.getMessage(), e);
            }
        }

        ReportStatus status = failedRules.isEmpty() ? ReportStatus.COMPLETED : ReportStatus.FAILED;
        ReconciliationReport report = ReconciliationReport.builder()
                .id(reportId)
                .type(type)
                .status(status)
                .startedAt(startedAt)
                .completedAt(clock.instant())
                .inconsistencies(findings)
                .failedRules(failedRules)
                .errorMessage(errors.isEmpty() ? null : String.join("; ", errors))
                .build();

        try {
            unitOfWork.run(() -> {
                ReconciliationReportEntity entity = reportRepository.findById(reportId)
                        .orElseThrow(() -> new IllegalStateException("Report vanished: " + reportId));
                entity.complete(report, this::toJson);
            });
        } catch (RuntimeException e) {
            markFailed(reportId, e);
            metrics.recordReconciliationRun(type, ReportStatus.FAILED, Duration.between(startedAt, clock.instant()));
            throw e;
        }

        metrics.recordReconciliationRun(type, status, Duration.between(startedAt, report.getCompletedAt()));
        log.info("Reconciliation {} finished: reportId={}, status={}, inconsistencies={}",
                type, reportId, status, report.getTotalInconsistencies());
        return report;
    }

    private void markFailed(UUID reportId, RuntimeException cause) {
        String message = "Report could not be completed: " + cause.getMessage();
        try {
            unitOfWork.run(() -> reportRepository.findById(reportId)
                    .ifPresent(entity -> entity.fail(message, clock.instant())));
            log.error("Reconciliation {} marked FAILED: {}", reportId, message, cause);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("Reconciliation {} left RUNNING, marking it FAILED also failed", reportId, cause);
        }
    }

    private ReconciliationReport toDomain(ReconciliationReportEntity entity) {
        List<Inconsistency> inconsistencies = entity.getInconsistencies().stream()
                .map(i -> new Inconsistency(i.getKind(), i.getEntityId(), fromJson(i.getDetails()), i.getDetectedAt()))
                .toList();
        return ReconciliationReport.builder()
                .id(entity.getId())
                .type(entity.getReportType())
                .status(entity.getStatus())
                .startedAt(entity.getStartedAt())
                .completedAt(entity.getCompletedAt())
                .inconsistencies(inconsistencies)
                .failedRules(entity.failedRuleNames())
                .errorMessage(entity.getErrorMessage())
                .build();
    }

    private String toJson(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize inconsistency details", e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> fromJson(String details) {
        if (details == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(details, Map.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable inconsistency details", e);
        }
    }
}
