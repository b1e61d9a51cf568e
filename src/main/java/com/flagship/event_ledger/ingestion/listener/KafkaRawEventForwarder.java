package com.flagship.event_ledger.ingestion.listener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.event_ledger.ingestion.RawEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes raw events to the raw-events topic, keyed by eventId so redeliveries
 * of one event land on the same partition. Waits for the broker ack before returning.
 */
@Component
@ConditionalOnProperty(name = "ingestion.forwarding", havingValue = "kafka")
@Slf4j
public class KafkaRawEventForwarder implements RawEventForwarder {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;

    public KafkaRawEventForwarder(KafkaTemplate<String, String> kafkaTemplate,
                                  ObjectMapper objectMapper,
                                  @Value("${kafka.topic.raw-events:raw-events}") String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
    }

    @Override
    public void forward(RawEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event);
            kafkaTemplate.send(topic, event.getEventId(), json).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.debug("Forwarded event {} to {}", event.getEventId(), topic);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize raw event " + event.getEventId(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HorizonStreamException("Interrupted while forwarding " + event.getEventId(), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new HorizonStreamException("Failed to forward " + event.getEventId() + " to Kafka", e);
        }
    }
}
