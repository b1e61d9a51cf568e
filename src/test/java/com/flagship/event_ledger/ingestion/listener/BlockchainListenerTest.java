package com.flagship.event_ledger.ingestion.listener;

import com.flagship.event_ledger.config.IngestionProperties;
import com.flagship.event_ledger.config.JacksonConfig;
import com.flagship.event_ledger.ingestion.RawEvent;
import com.flagship.event_ledger.observability.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class BlockchainListenerTest {

    private static final String STREAM = "horizon-transactions";

    private HorizonStreamClient streamClient;
    private RawEventForwarder forwarder;
    private IngestionCursorStore cursorStore;
    private SimpleMeterRegistry meterRegistry;
    private BlockchainListener listener;

    @BeforeEach
    void setUp() {
        streamClient = mock(HorizonStreamClient.class);
        forwarder = mock(RawEventForwarder.class);
        cursorStore = mock(IngestionCursorStore.class);
        meterRegistry = new SimpleMeterRegistry();

        IngestionProperties properties = new IngestionProperties();
        properties.getListener().setStreamName(STREAM);
        properties.getListener().setBaseDelayMs(10);
        properties.getListener().setMaxDelayMs(50);
        properties.getListener().setJitterFactor(0);

        listener = new BlockchainListener(streamClient,
                new HorizonEventMapper(new JacksonConfig().objectMapper()),
                forwarder, cursorStore, new PipelineMetrics(meterRegistry), properties);
    }

    @AfterEach
    void tearDown() {
        listener.stopListening();
    }

    private static HorizonTransaction tx(String pagingToken, boolean successful) {
        return HorizonTransaction.builder()
                .id("tx-" + pagingToken)
                .pagingToken(pagingToken)
                .successful(successful)
                .hash("hash-" + pagingToken)
                .ledger(100L)
                .createdAt(Instant.parse("2026-05-01T00:00:00Z"))
                .sourceAccount("GSOURCE")
                .build();
    }

    @Test
    @DisplayName("Each transaction is forwarded, then the cursor moves past it")
    void testForwardsAndCommitsCursor() {
        when(cursorStore.load(STREAM)).thenReturn(Optional.empty());
        when(streamClient.streamTransactions("now"))
                .thenReturn(Flux.just(tx("1", true), tx("2", true)).concatWith(Flux.never()));

        listener.startListening();

        verify(forwarder, timeout(2000).times(2)).forward(any(RawEvent.class));
        verify(cursorStore, timeout(2000)).save(STREAM, "2");
        var inOrder = inOrder(forwarder, cursorStore);
        inOrder.verify(forwarder).forward(argThat(e -> e.getEventId().equals("hash-1")));
        inOrder.verify(cursorStore).save(STREAM, "1");
        assertTrue(listener.isListening());
        assertEquals("2", listener.getLastCursor());
        assertEquals(2.0, meterRegistry.counter("ingestion.listener.messages").count());
    }

    @Test
    @DisplayName("After a transport error the stream reopens from the committed cursor")
    void testReconnectsFromCursor() {
        when(cursorStore.load(STREAM)).thenReturn(Optional.empty(), Optional.of("1"));
        when(streamClient.streamTransactions("now"))
                .thenReturn(Flux.just(tx("1", true)).concatWith(Flux.error(new HorizonStreamException("reset"))));
        when(streamClient.streamTransactions("1"))
                .thenReturn(Flux.just(tx("2", true)).concatWith(Flux.never()));

        listener.startListening();

        verify(streamClient, timeout(2000)).streamTransactions("1");
        verify(cursorStore, timeout(2000)).save(STREAM, "2");
        verify(forwarder, timeout(2000).times(2)).forward(any(RawEvent.class));
        assertEquals(1.0, meterRegistry.counter("ingestion.listener.reconnects").count());
    }

    @Test
    @DisplayName("A forwarding failure keeps the cursor and redelivers the transaction")
    void testForwardFailureRedelivers() {
        when(cursorStore.load(STREAM)).thenReturn(Optional.empty());
        when(streamClient.streamTransactions("now"))
                .thenAnswer(invocation -> Flux.just(tx("1", true)).concatWith(Flux.never()));
        doThrow(new HorizonStreamException("broker down")).doNothing().when(forwarder).forward(any(RawEvent.class));

        listener.startListening();

        verify(cursorStore, timeout(2000)).save(STREAM, "1");
        ArgumentCaptor<RawEvent> forwarded = ArgumentCaptor.forClass(RawEvent.class);
        verify(forwarder, times(2)).forward(forwarded.capture());
        assertEquals(forwarded.getAllValues().get(0).getEventId(), forwarded.getAllValues().get(1).getEventId());
        verify(cursorStore, times(1)).save(eq(STREAM), anyString());
    }

    @Test
    @DisplayName("Failed chain transactions are not forwarded but still advance the cursor")
    void testFailedTransactionSkipped() {
        when(cursorStore.load(STREAM)).thenReturn(Optional.empty());
        when(streamClient.streamTransactions("now"))
                .thenReturn(Flux.just(tx("5", false)).concatWith(Flux.never()));

        listener.startListening();

        verify(cursorStore, timeout(2000)).save(STREAM, "5");
        verify(forwarder, never()).forward(any());
    }

    @Test
    @DisplayName("stopListening disposes the stream and start is idempotent")
    void testStartStop() {
        when(cursorStore.load(STREAM)).thenReturn(Optional.empty());
        when(streamClient.streamTransactions("now")).thenReturn(Flux.never());

        listener.startListening();
        listener.startListening();
        assertTrue(listener.isListening());
        verify(streamClient, timeout(2000).times(1)).streamTransactions("now");

        listener.stopListening();
        assertFalse(listener.isListening());
    }
}
