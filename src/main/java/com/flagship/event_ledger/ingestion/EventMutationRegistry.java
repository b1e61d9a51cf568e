package com.flagship.event_ledger.ingestion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed mapping from raw event type to the mutation that applies it.
 * Built once at startup; unknown types have no handler.
 */
public class EventMutationRegistry {

    private final Map<String, EventMutationHandler> handlers;

    public EventMutationRegistry(Map<String, EventMutationHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    public Optional<EventMutationHandler> find(String eventType) {
        return Optional.ofNullable(handlers.get(eventType));
    }

    public Set<String> registeredTypes() {
        return handlers.keySet();
    }
}
