package com.flagship.event_ledger.reconciliation;

import lombok.Value;

import java.util.List;

@Value
public class PaginatedReports {
    List<ReconciliationReport> data;
    long total;
    int page;
    int limit;
    int totalPages;
}
