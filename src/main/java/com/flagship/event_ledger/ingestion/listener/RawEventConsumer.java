package com.flagship.event_ledger.ingestion.listener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.event_ledger.ingestion.EventProcessor;
import com.flagship.event_ledger.ingestion.IngestionResult;
import com.flagship.event_ledger.ingestion.RawEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Consumes the raw-events topic and hands each event to the processor.
 *
 * Key design decisions:
 * - Manual acknowledgment: the offset is committed only after the raw event is stored
 * - Malformed or invalid messages are acknowledged and dropped, they can never succeed
 * - Mutation failures are acknowledged too: the event is stored unprocessed and the
 *   reprocessing sweep owns its retries
 * - Storage failures are not acknowledged, so the message is redelivered
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RawEventConsumer {

    private final EventProcessor eventProcessor;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.raw-events:raw-events}",
        groupId = "${spring.kafka.consumer.group-id:event-ledger-ingestion}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received raw event: partition={}, offset={}, key={}",
                record.partition(), record.offset(), record.key());

        RawEvent event;
        try {
            event = objectMapper.readValue(record.value(), RawEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable raw event at offset {}, skipping: {}", record.offset(), e.getOriginalMessage());
            ack.acknowledge();
            return;
        }

        try {
            IngestionResult result = eventProcessor.ingest(event);
            ack.acknowledge();
            log.debug("Raw event {} consumed: {}", event.getEventId(), result);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid raw event at offset {}, skipping: {}", record.offset(), e.getMessage());
            ack.acknowledge();
        }
    }
}
