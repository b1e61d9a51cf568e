package com.flagship.event_ledger.ingestion.listener;

import com.flagship.event_ledger.ingestion.EventProcessor;
import com.flagship.event_ledger.ingestion.IngestionResult;
import com.flagship.event_ledger.ingestion.RawEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * In-process forwarding: the listener thread runs the processor itself.
 * Invalid events are logged and dropped; storage failures propagate so the
 * stream is retried from the last committed cursor.
 */
@Component
@ConditionalOnProperty(name = "ingestion.forwarding", havingValue = "direct", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DirectRawEventForwarder implements RawEventForwarder {

    private final EventProcessor eventProcessor;

    @Override
    public void forward(RawEvent event) {
        try {
            IngestionResult result = eventProcessor.ingest(event);
            log.debug("Event {} ingested: {}", event.getEventId(), result);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping invalid event {}: {}", event.getEventId(), e.getMessage());
        }
    }
}
