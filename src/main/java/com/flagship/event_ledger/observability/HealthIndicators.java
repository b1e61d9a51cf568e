package com.flagship.event_ledger.observability;

import com.flagship.event_ledger.config.IngestionProperties;
import com.flagship.event_ledger.ingestion.RawEventRepository;
import com.flagship.event_ledger.ingestion.listener.BlockchainListener;
import com.flagship.event_ledger.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the event ledger.
 *
 * Used by readiness probes and load balancers.
 */
public class HealthIndicators {

    private static Health.Builder byBacklog(long size, long warning, long critical) {
        Health.Builder builder = size < warning
                ? Health.up()
                : size < critical
                ? Health.status("WARNING")
                : Health.down();
        return builder
                .withDetail("backlogSize", size)
                .withDetail("warningThreshold", warning)
                .withDetail("criticalThreshold", critical);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Unhealthy if too many listing change events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                return byBacklog(outboxRepository.countUnpublished(),
                        BACKLOG_WARNING_THRESHOLD, BACKLOG_CRITICAL_THRESHOLD).build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    /**
     * Unprocessed raw events and the state of the chain listener.
     */
    @Component("ingestionHealth")
    public static class IngestionHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 500;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 5000;

        private final RawEventRepository rawEventRepository;
        private final BlockchainListener listener;
        private final IngestionProperties properties;

        public IngestionHealthIndicator(RawEventRepository rawEventRepository,
                                        BlockchainListener listener,
                                        IngestionProperties properties) {
            this.rawEventRepository = rawEventRepository;
            this.listener = listener;
            this.properties = properties;
        }

        @Override
        public Health health() {
            try {
                Health.Builder builder = byBacklog(rawEventRepository.countByProcessedFalse(),
                        BACKLOG_WARNING_THRESHOLD, BACKLOG_CRITICAL_THRESHOLD);
                if (properties.getListener().isEnabled() && !listener.isListening()) {
                    builder = Health.down().withDetail("error", "Listener enabled but not running");
                }
                return builder
                        .withDetail("listening", listener.isListening())
                        .withDetail("cursor", String.valueOf(listener.getLastCursor()))
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    /**
     * Redis only backs the deduplication fast path, so its absence degrades rather than fails.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }
                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up().withDetail("response", result).build();
                    }
                    return Health.down().withDetail("response", result != null ? result : "null").build();
                }
            } catch (Exception e) {
                return degraded(describe(e));
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Deduplication falls back to the database")
                    .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up().withDetail("metricsCount", metrics.size()).build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }
}
