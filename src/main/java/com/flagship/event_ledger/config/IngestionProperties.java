package com.flagship.event_ledger.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Chain listener, forwarding, dedup cache and reprocessing settings. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "ingestion")
@NoArgsConstructor
@Getter
@Setter
public class IngestionProperties {

    /** How the listener hands events to the processor: "direct" or "kafka". */
    private String forwarding = "direct";

    private Listener listener = new Listener();

    private DedupCache dedupCache = new DedupCache();

    private Reprocessing reprocessing = new Reprocessing();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Listener {

        private boolean enabled = false;

        /** Horizon base URL; the listener streams {horizonUrl}/transactions. */
        private String horizonUrl = "https://horizon-testnet.stellar.org";

        /** Key under which the stream cursor is committed. */
        private String streamName = "horizon-transactions";

        /** Base reconnect delay in ms; doubles each consecutive failure. */
        private long baseDelayMs = 1000L;

        /** Upper bound for the reconnect delay in ms. */
        private long maxDelayMs = 60_000L;

        /** Jitter factor 0..1 (0.2 = ±20%). */
        private double jitterFactor = 0.2;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class DedupCache {

        private boolean enabled = false;

        private Duration ttl = Duration.ofDays(7);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Reprocessing {

        private boolean enabled = true;

        private long intervalMs = 30_000L;

        private int batchSize = 100;

        /** Events that failed this many times are left for manual inspection. */
        private int maxAttempts = 10;
    }
}
