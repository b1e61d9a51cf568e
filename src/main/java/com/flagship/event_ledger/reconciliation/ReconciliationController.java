package com.flagship.event_ledger.reconciliation;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Admin API for reconciliation.
 */
@RestController
@RequestMapping("/admin/reconciliation")
@RequiredArgsConstructor
@Slf4j
public class ReconciliationController {

    private final ReconciliationService reconciliationService;
    private final ReconciliationScheduler scheduler;

    @PostMapping("/run")
    public ReconciliationReport run() {
        log.info("Manual reconciliation requested");
        return scheduler.runManual();
    }

    @GetMapping("/reports")
    public PaginatedReports getReports(@RequestParam(name = "page", defaultValue = "1") @Min(1) int page,
                                       @RequestParam(name = "limit", defaultValue = "20") @Min(1) @Max(100) int limit) {
        return reconciliationService.getReports(page, limit);
    }

    @GetMapping("/reports/{id}")
    public ReconciliationReport getReport(@PathVariable("id") UUID id) {
        return reconciliationService.getReportById(id);
    }

    @GetMapping("/summary")
    public ReportSummary getSummary() {
        return reconciliationService.getLatestReportSummary();
    }

    @GetMapping("/status")
    public SchedulerStatus getStatus() {
        return scheduler.getStatus();
    }

    @PutMapping("/scheduler")
    public SchedulerStatus setSchedulerEnabled(@RequestParam("enabled") boolean enabled) {
        scheduler.setEnabled(enabled);
        return scheduler.getStatus();
    }

    @GetMapping("/check/{rule}")
    public Map<String, Object> check(@PathVariable("rule") String rule) {
        List<Inconsistency> found = reconciliationService.runRule(rule);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", found.size());
        body.put("inconsistencies", found);
        return body;
    }
}
