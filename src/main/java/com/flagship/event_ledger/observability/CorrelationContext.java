package com.flagship.event_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the pipeline.
 *
 * The correlation id comes from the X-Correlation-ID header for HTTP requests
 * and from the raw event id for ingested events, so every log line produced
 * while applying one chain event can be found by that event's id.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String EVENT_ID_MDC_KEY = "eventId";
    public static final String AGGREGATE_ID_MDC_KEY = "aggregateId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation id, generating one if none is set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        String value = id != null && !id.isBlank() ? id : generateCorrelationId();
        correlationId.set(value);
        MDC.put(CORRELATION_ID_MDC_KEY, value);
    }

    /**
     * Binds the context of one raw event to the current thread.
     * Pair with {@link #clear()} in a finally block.
     */
    public static void enterEvent(String eventId) {
        setCorrelationId(eventId);
        MDC.put(EVENT_ID_MDC_KEY, eventId);
    }

    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(EVENT_ID_MDC_KEY);
        MDC.remove(AGGREGATE_ID_MDC_KEY);
    }

    /**
     * Short random id, readable in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
