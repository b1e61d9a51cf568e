package com.flagship.event_ledger.reconciliation.rule;

import com.flagship.event_ledger.reconciliation.Inconsistency;
import com.flagship.event_ledger.reconciliation.InconsistencyKind;

import java.util.List;

/**
 * A read-only detection query over storage state. Rules never modify data and
 * return their findings in a stable order.
 */
public interface ReconciliationRule {

    /**
     * Name used in reports and the admin check endpoint, e.g. "negative-balances".
     */
    String name();

    InconsistencyKind kind();

    List<Inconsistency> detect();
}
