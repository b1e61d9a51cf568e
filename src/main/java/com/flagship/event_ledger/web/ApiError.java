package com.flagship.event_ledger.web;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response.
 */
@Value
@Builder
public class ApiError {
    /** Machine-readable error code, e.g. CONCURRENCY_CONFLICT. */
    String code;
    String error;
    String message;
    Map<String, Object> details;
    Instant timestamp;
}
