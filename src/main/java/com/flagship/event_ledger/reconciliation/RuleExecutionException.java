package com.flagship.event_ledger.reconciliation;

import lombok.Getter;

/**
 * A reconciliation rule could not complete its detection query.
 */
@Getter
public class RuleExecutionException extends RuntimeException {

    private final String ruleName;

    public RuleExecutionException(String ruleName, Throwable cause) {
        super("Reconciliation rule " + ruleName + " failed: " + cause.getMessage(), cause);
        this.ruleName = ruleName;
    }
}
