package com.flagship.event_ledger.common;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter, capped at a maximum delay.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    public RetryPolicy(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                    "Invalid backoff bounds: base=" + baseDelayMs + "ms, max=" + maxDelayMs + "ms");
        }
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("Jitter factor must be within 0..1: " + jitterFactor);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * Delay before the given zero-based retry attempt: base * 2^attempt, capped, then jittered.
     */
    public Duration delayFor(long attempt) {
        long exponential = attempt <= 0
                ? baseDelayMs
                : baseDelayMs * (1L << Math.min(attempt, 20));
        return Duration.ofMillis(jitter(Math.min(exponential, maxDelayMs)));
    }

    private long jitter(long value) {
        if (jitterFactor == 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double factor = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * factor));
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
