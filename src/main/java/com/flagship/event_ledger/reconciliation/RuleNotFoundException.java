package com.flagship.event_ledger.reconciliation;

public class RuleNotFoundException extends RuntimeException {

    public RuleNotFoundException(String ruleName) {
        super("Unknown reconciliation rule: " + ruleName);
    }
}
