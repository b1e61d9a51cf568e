package com.flagship.event_ledger.reconciliation;

import java.util.UUID;

public class ReportNotFoundException extends RuntimeException {

    public ReportNotFoundException(UUID reportId) {
        super("Reconciliation report not found: " + reportId);
    }
}
