package com.flagship.event_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics owned by this service.
 *
 * - raw-events: queue between the chain listener and the event processor, keyed by eventId
 * - listing-changes: outbox stream of write-model changes, keyed by listing id
 */
@Configuration
@ConditionalOnProperty(name = "kafka.topics.auto-create", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.raw-events:raw-events}")
    private String rawEventsTopic;

    @Value("${kafka.topic.listing-changes:listing-changes}")
    private String listingChangesTopic;

    @Bean
    public NewTopic rawEventsTopic() {
        return TopicBuilder.name(rawEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic listingChangesTopic() {
        return TopicBuilder.name(listingChangesTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
