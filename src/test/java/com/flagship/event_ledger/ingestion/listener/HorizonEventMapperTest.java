package com.flagship.event_ledger.ingestion.listener;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.event_ledger.config.JacksonConfig;
import com.flagship.event_ledger.ingestion.EventTypes;
import com.flagship.event_ledger.ingestion.RawEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HorizonEventMapperTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private final HorizonEventMapper mapper = new HorizonEventMapper(objectMapper);

    private HorizonTransaction.HorizonTransactionBuilder tx() {
        return HorizonTransaction.builder()
                .id("tx-1")
                .pagingToken("123456789")
                .successful(true)
                .hash("abc123")
                .ledger(4242L)
                .createdAt(Instant.parse("2026-05-01T10:15:30Z"))
                .sourceAccount("GSOURCE")
                .operationCount(1);
    }

    @Test
    @DisplayName("A JSON memo becomes a platform event with its own id and payload")
    void testMemoEvent() {
        HorizonTransaction transaction = tx()
                .memoType("text")
                .memo("{\"type\":\"registration.confirmed\",\"id\":\"evt-77\",\"payload\":{\"userId\":\"u1\"}}")
                .build();

        RawEvent event = mapper.toRawEvent(transaction).orElseThrow();

        assertEquals("evt-77", event.getEventId());
        assertEquals("registration.confirmed", event.getType());
        assertEquals("{\"userId\":\"u1\"}", event.getPayload());
        assertEquals("GSOURCE", event.getContract());
        assertEquals(4242L, event.getBlockNumber());
        assertEquals(Instant.parse("2026-05-01T10:15:30Z"), event.getTimestamp());
    }

    @Test
    @DisplayName("A memo event without an id is keyed by the transaction hash")
    void testMemoEventWithoutId() {
        HorizonTransaction transaction = tx()
                .memoType("text")
                .memo("{\"type\":\"ledger.deposit\",\"payload\":{\"amount\":\"5\"}}")
                .build();

        RawEvent event = mapper.toRawEvent(transaction).orElseThrow();

        assertEquals("abc123", event.getEventId());
        assertEquals(EventTypes.LEDGER_DEPOSIT, event.getType());
    }

    @Test
    @DisplayName("A plain transaction becomes a stellar.transaction summary")
    void testPlainTransaction() throws Exception {
        HorizonTransaction transaction = tx().memoType("text").memo("hello").build();

        RawEvent event = mapper.toRawEvent(transaction).orElseThrow();

        assertEquals(EventTypes.STELLAR_TRANSACTION, event.getType());
        assertEquals("abc123", event.getEventId());
        assertEquals("abc123", objectMapper.readTree(event.getPayload()).get("hash").asText());
        assertEquals("hello", objectMapper.readTree(event.getPayload()).get("memo").asText());
    }

    @Test
    @DisplayName("Malformed JSON memos fall back to the plain mapping")
    void testMalformedMemo() {
        HorizonTransaction transaction = tx().memoType("text").memo("{not json").build();

        assertEquals(EventTypes.STELLAR_TRANSACTION, mapper.toRawEvent(transaction).orElseThrow().getType());
    }

    @Test
    @DisplayName("Failed transactions produce no event")
    void testFailedTransaction() {
        Optional<RawEvent> event = mapper.toRawEvent(tx().successful(false).build());

        assertTrue(event.isEmpty());
    }

    @Test
    @DisplayName("Horizon JSON deserializes into the transaction fields")
    void testHorizonJson() throws Exception {
        String json = """
                {"id":"tx-9","paging_token":"987","successful":true,"hash":"ff00","ledger":77,
                 "created_at":"2026-05-01T10:15:30Z","source_account":"GSRC","memo_type":"none",
                 "operation_count":2,"fee_charged":"100"}
                """;

        HorizonTransaction transaction = objectMapper.readValue(json, HorizonTransaction.class);

        assertEquals("987", transaction.getPagingToken());
        assertEquals(77L, transaction.getLedger());
        assertEquals("GSRC", transaction.getSourceAccount());
        assertEquals(2, transaction.getOperationCount());
        assertTrue(transaction.isSuccessful());
    }
}
