package com.flagship.event_ledger.reconciliation;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One finding of a reconciliation rule.
 */
@Value
public class Inconsistency {
    InconsistencyKind kind;
    String entityId;
    Map<String, Object> details;
    Instant detectedAt;

    public Inconsistency(InconsistencyKind kind, String entityId, Map<String, Object> details, Instant detectedAt) {
        this.kind = kind;
        this.entityId = entityId;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.detectedAt = detectedAt;
    }
}
