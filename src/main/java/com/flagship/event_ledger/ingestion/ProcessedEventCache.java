package com.flagship.event_ledger.ingestion;

import com.flagship.event_ledger.config.IngestionProperties;
import com.flagship.event_ledger.observability.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis fast path for duplicate detection.
 *
 * Strategy:
 * 1. A hit means the event was processed; the database is not consulted
 * 2. A miss, a disabled cache or an unreachable Redis all fall through to the
 *    database check under the raw event row lock, which is authoritative
 * 3. Ids are written only after the processing transaction committed
 */
@Component
@Slf4j
public class ProcessedEventCache {

    private static final String KEY_PREFIX = "raw-event:processed:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean enabled;
    private final Duration ttl;
    private final PipelineMetrics metrics;

    public ProcessedEventCache(Optional<StringRedisTemplate> redisTemplate,
                               IngestionProperties properties,
                               PipelineMetrics metrics) {
        this.redisTemplate = redisTemplate;
        this.enabled = properties.getDedupCache().isEnabled() && redisTemplate.isPresent();
        this.ttl = properties.getDedupCache().getTtl();
        this.metrics = metrics;
    }

    public boolean isProcessed(String eventId) {
        if (!enabled) {
            return false;
        }
        try {
            boolean hit = Boolean.TRUE.equals(redisTemplate.get().hasKey(KEY_PREFIX + eventId));
            metrics.recordDedupCache(hit);
            return hit;
        } catch (Exception e) {
            log.warn("Redis lookup failed for event {}, falling back to database: {}", eventId, e.getMessage());
            return false;
        }
    }

    public void markProcessed(String eventId) {
        if (!enabled) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(KEY_PREFIX + eventId, "1", ttl);
        } catch (Exception e) {
            log.debug("Failed to cache processed event {}: {}", eventId, e.getMessage());
        }
    }
}
