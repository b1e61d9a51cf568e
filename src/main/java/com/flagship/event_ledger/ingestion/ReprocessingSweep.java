package com.flagship.event_ledger.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically retries raw events whose mutation failed.
 */
@Component
@ConditionalOnProperty(prefix = "ingestion.reprocessing", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReprocessingSweep {

    private final EventProcessor eventProcessor;

    @Scheduled(fixedDelayString = "${ingestion.reprocessing.interval-ms:30000}",
               initialDelayString = "${ingestion.reprocessing.interval-ms:30000}")
    public void sweep() {
        try {
            eventProcessor.reprocessPending();
        } catch (Exception e) {
            log.error("Reprocessing sweep failed", e);
        }
    }
}
