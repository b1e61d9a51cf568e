package com.flagship.event_ledger.ingestion.listener;

import com.flagship.event_ledger.common.RetryPolicy;
import com.flagship.event_ledger.config.IngestionProperties;
import com.flagship.event_ledger.observability.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streams Horizon transactions and forwards them as raw events.
 *
 * The cursor is committed only after the forwarder accepted the event, so a crash or
 * reconnect resumes from the last forwarded transaction. Anything re-sent after a
 * reconnect is absorbed by processor-side deduplication. Transport errors reconnect
 * with exponential backoff; a server-side close reconnects after the base delay.
 */
@Component
@Slf4j
public class BlockchainListener implements SmartLifecycle {

    static final String LIVE_CURSOR = "now";

    private final HorizonStreamClient streamClient;
    private final HorizonEventMapper eventMapper;
    private final RawEventForwarder forwarder;
    private final IngestionCursorStore cursorStore;
    private final PipelineMetrics metrics;
    private final IngestionProperties.Listener settings;
    private final RetryPolicy retryPolicy;

    private final AtomicLong consecutiveFailures = new AtomicLong();
    private volatile Disposable subscription;
    private volatile String lastCursor;

    public BlockchainListener(HorizonStreamClient streamClient,
                              HorizonEventMapper eventMapper,
                              RawEventForwarder forwarder,
                              IngestionCursorStore cursorStore,
                              PipelineMetrics metrics,
                              IngestionProperties properties) {
        this.streamClient = streamClient;
        this.eventMapper = eventMapper;
        this.forwarder = forwarder;
        this.cursorStore = cursorStore;
        this.metrics = metrics;
        this.settings = properties.getListener();
        this.retryPolicy = new RetryPolicy(
                settings.getBaseDelayMs(), settings.getMaxDelayMs(), settings.getJitterFactor());
    }

    public synchronized void startListening() {
        if (isListening()) {
            log.debug("Listener already running");
            return;
        }
        log.info("Starting Horizon listener: url={}, stream={}", settings.getHorizonUrl(), settings.getStreamName());
        subscription = Flux.defer(this::openStream)
                .publishOn(Schedulers.boundedElastic())
                .doOnNext(this::handle)
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    long attempt = consecutiveFailures.getAndIncrement();
                    Duration delay = retryPolicy.delayFor(attempt);
                    metrics.recordListenerReconnect();
                    log.warn("Horizon stream failed (attempt {}), reconnecting in {} ms: {}",
                            attempt + 1, delay.toMillis(), signal.failure().getMessage());
                    return Mono.delay(delay);
                })))
                .repeatWhen(completions -> completions.concatMap(closed -> {
                    log.info("Horizon stream closed by server, reconnecting");
                    return Mono.delay(Duration.ofMillis(retryPolicy.getBaseDelayMs()));
                }))
                .subscribe(
                        tx -> { },
                        error -> log.error("Horizon listener terminated", error),
                        () -> log.info("Horizon listener completed"));
    }

    public synchronized void stopListening() {
        Disposable current = subscription;
        if (current != null && !current.isDisposed()) {
            current.dispose();
            log.info("Horizon listener stopped at cursor {}", lastCursor);
        }
        subscription = null;
    }

    public boolean isListening() {
        Disposable current = subscription;
        return current != null && !current.isDisposed();
    }

    /** Last cursor committed by this listener, or null before the first message. */
    public String getLastCursor() {
        return lastCursor;
    }

    private Flux<HorizonTransaction> openStream() {
        String cursor = cursorStore.load(settings.getStreamName()).orElse(LIVE_CURSOR);
        log.info("Opening Horizon stream from cursor {}", cursor);
        return streamClient.streamTransactions(cursor);
    }

    private void handle(HorizonTransaction tx) {
        eventMapper.toRawEvent(tx).ifPresent(forwarder::forward);
        if (tx.getPagingToken() != null) {
            cursorStore.save(settings.getStreamName(), tx.getPagingToken());
            lastCursor = tx.getPagingToken();
        }
        consecutiveFailures.set(0);
        metrics.recordListenerMessage();
    }

    // ==================== Lifecycle ====================

    @Override
    public void start() {
        if (settings.isEnabled()) {
            startListening();
        } else {
            log.info("Horizon listener disabled");
        }
    }

    @Override
    public void stop() {
        stopListening();
    }

    @Override
    public boolean isRunning() {
        return isListening();
    }

    @Override
    public int getPhase() {
        // Start after the processing side, stop before it.
        return Integer.MAX_VALUE - 100;
    }
}
