package com.flagship.event_ledger.ingestion.listener;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.event_ledger.config.JacksonConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the SSE client against canned exchanges instead of a live Horizon.
 */
class WebClientHorizonStreamClientTest {

    private static final String TX_ONE = "{\"id\":\"tx-1\",\"paging_token\":\"100\",\"successful\":true,"
            + "\"hash\":\"h1\",\"ledger\":7,\"created_at\":\"2026-05-01T10:15:30Z\",\"source_account\":\"GSRC\","
            + "\"memo_type\":\"text\",\"memo\":\"hello\",\"operation_count\":1,\"fee_charged\":\"100\"}";
    private static final String TX_TWO = "{\"id\":\"tx-2\",\"paging_token\":\"101\",\"successful\":false,"
            + "\"hash\":\"h2\",\"ledger\":8,\"created_at\":\"2026-05-01T10:15:35Z\",\"source_account\":\"GSRC\","
            + "\"operation_count\":2}";

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

    private HorizonStreamClient client(ExchangeFunction exchange) {
        return new WebClientHorizonStreamClient(WebClient.builder().exchangeFunction(exchange),
                "https://horizon.test", objectMapper);
    }

    private static Mono<ClientResponse> stream(String body) {
        return Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
                .body(body)
                .build());
    }

    @Test
    @DisplayName("Transactions are decoded in stream order and the hello event is skipped")
    void testStreamDecoding() {
        AtomicReference<ClientRequest> sent = new AtomicReference<>();
        HorizonStreamClient client = client(request -> {
            sent.set(request);
            return stream("retry: 1000\nevent: open\ndata: \"hello\"\n\n"
                    + "id: 100\ndata: " + TX_ONE + "\n\n"
                    + "id: 101\ndata: " + TX_TWO + "\n\n");
        });

        StepVerifier.create(client.streamTransactions("99"))
                .assertNext(tx -> {
                    assertEquals("tx-1", tx.getId());
                    assertEquals("100", tx.getPagingToken());
                    assertTrue(tx.isSuccessful());
                    assertEquals(7L, tx.getLedger());
                    assertEquals(Instant.parse("2026-05-01T10:15:30Z"), tx.getCreatedAt());
                    assertEquals("hello", tx.getMemo());
                })
                .assertNext(tx -> {
                    assertEquals("tx-2", tx.getId());
                    assertFalse(tx.isSuccessful());
                    assertNull(tx.getMemo());
                })
                .verifyComplete();

        assertEquals("/transactions", sent.get().url().getPath());
        assertEquals("cursor=99", sent.get().url().getQuery());
        assertEquals(MediaType.TEXT_EVENT_STREAM, sent.get().headers().getAccept().get(0));
    }

    @Test
    @DisplayName("An error status from Horizon surfaces as HorizonStreamException")
    void testErrorStatus() {
        HorizonStreamClient client = client(request ->
                Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build()));

        StepVerifier.create(client.streamTransactions("now"))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(HorizonStreamException.class, e);
                    assertTrue(e.getMessage().contains("503"));
                })
                .verify();
    }

    @Test
    @DisplayName("A connection failure surfaces as HorizonStreamException")
    void testUnreachable() {
        HorizonStreamClient client = client(request -> Mono.error(new WebClientRequestException(
                new IOException("Connection refused"), HttpMethod.GET, URI.create("https://horizon.test/transactions"),
                new HttpHeaders())));

        StepVerifier.create(client.streamTransactions("now"))
                .expectErrorMatches(e -> e instanceof HorizonStreamException
                        && e.getMessage().startsWith("Horizon unreachable"))
                .verify();
    }

    @Test
    @DisplayName("A malformed record ends the stream with HorizonStreamException after the good ones")
    void testMalformedRecord() {
        HorizonStreamClient client = client(request -> stream(
                "data: " + TX_ONE + "\n\n" + "data: {\"ledger\":\"not-a-number\"}\n\n"));

        StepVerifier.create(client.streamTransactions("now"))
                .expectNextMatches(tx -> "tx-1".equals(tx.getId()))
                .expectError(HorizonStreamException.class)
                .verify();
    }
}
