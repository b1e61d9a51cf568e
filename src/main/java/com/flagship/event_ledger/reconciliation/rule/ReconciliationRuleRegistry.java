package com.flagship.event_ledger.reconciliation.rule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rules in the order they run. Built once at startup.
 */
public class ReconciliationRuleRegistry {

    private final Map<String, ReconciliationRule> rules = new LinkedHashMap<>();

    public ReconciliationRuleRegistry(List<ReconciliationRule> orderedRules) {
        for (ReconciliationRule rule : orderedRules) {
            if (rules.putIfAbsent(rule.name(), rule) != null) {
                throw new IllegalArgumentException("Duplicate reconciliation rule: " + rule.name());
            }
        }
    }

    public List<ReconciliationRule> all() {
        return List.copyOf(rules.values());
    }

    public Optional<ReconciliationRule> find(String name) {
        return Optional.ofNullable(rules.get(name));
    }
}
