package com.flagship.event_ledger.outbox;

import com.flagship.event_ledger.observability.CorrelationContext;
import com.flagship.event_ledger.observability.OutboxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Polls the outbox and publishes listing change events to Kafka.
 *
 * Key design decisions:
 * - Batches are claimed with SELECT ... FOR UPDATE SKIP LOCKED so several instances can run
 * - Sends are synchronous and in sequence order, keyed by listing id, so per-listing order holds
 * - Events over the retry limit are left in place and counted as dead letters
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OutboxPublisher {

    static final String EVENT_TYPE_HEADER = "event-type";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final String listingChangesTopic;
    private final int batchSize;
    private final int maxRetries;

    public OutboxPublisher(OutboxService outboxService,
                           KafkaTemplate<String, String> kafkaTemplate,
                           OutboxMetrics outboxMetrics,
                           @Value("${kafka.topic.listing-changes:listing-changes}") String listingChangesTopic,
                           @Value("${outbox.publisher.batch-size:100}") int batchSize,
                           @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxService = outboxService;
        this.kafkaTemplate = kafkaTemplate;
        this.outboxMetrics = outboxMetrics;
        this.listingChangesTopic = listingChangesTopic;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
    }

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.claimBatch(maxRetries, batchSize);
        } catch (Exception e) {
            log.error("Failed to claim outbox batch", e);
            return;
        }
        if (batch.isEmpty()) {
            return;
        }

        log.debug("Publishing {} outbox events", batch.size());
        for (OutboxEvent event : batch) {
            if (!publish(event)) {
                // Stop at the first failure so later changes to the same listing are not published ahead of it.
                break;
            }
        }
    }

    boolean publish(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
                topicFor(event), event.getAggregateId().toString(), event.getPayload());
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
        record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                CorrelationContext.getCorrelationId().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(10, TimeUnit.SECONDS);
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

            log.debug("Published outbox event {} to {}-{}@{}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
            return false;
        } catch (ExecutionException | TimeoutException e) {
            String reason = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            outboxService.markFailed(event.getId(), reason);
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Outbox event {} reached the retry limit ({}) and is dead-lettered: type={}, aggregateId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
            return false;
        }
    }

    private String topicFor(OutboxEvent event) {
        if ("Listing".equals(event.getAggregateType())) {
            return listingChangesTopic;
        }
        throw new IllegalStateException("No topic for aggregate type " + event.getAggregateType());
    }
}
