package com.flagship.event_ledger.ingestion;

import com.flagship.event_ledger.listing.ConcurrencyControlService;
import com.flagship.event_ledger.listing.Listing;
import com.flagship.event_ledger.readmodel.MaterializedViewService;
import com.flagship.event_ledger.support.TestDatabase;
import com.flagship.event_ledger.wagering.BetStatus;
import com.flagship.event_ledger.wagering.WageringService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exactly-once application of raw events: duplicates are no-ops, failures leave the
 * event unprocessed for the sweep, and a mutation never commits without its processed flag.
 */
@SpringBootTest
@ActiveProfiles("test")
class EventProcessorTest {

    @Autowired
    private EventProcessor eventProcessor;

    @Autowired
    private ConcurrencyControlService concurrencyControl;

    @Autowired
    private MaterializedViewService materializedViewService;

    @Autowired
    private WageringService wageringService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private long block;

    @BeforeEach
    void setUp() {
        TestDatabase.clean(jdbcTemplate);
        block = 1000;
    }

    private RawEvent event(String type, String payload) {
        return RawEvent.builder()
                .eventId("evt-" + UUID.randomUUID())
                .contract("GCONTRACT")
                .type(type)
                .payload(payload)
                .blockNumber(block++)
                .timestamp(Instant.parse("2026-03-01T12:00:00Z"))
                .build();
    }

    private RawEvent listingCreated(UUID listingId, String title) {
        return event(EventTypes.LISTING_CREATED, """
                {"listingId": "%s", "title": "%s", "organizerId": "org-7", "organizerName": "Horizon Club",
                 "capacity": 50, "status": "PUBLISHED"}
                """.formatted(listingId, title));
    }

    private boolean isProcessed(String eventId) {
        return jdbcTemplate.queryForObject(
                "SELECT processed FROM raw_events WHERE event_id = ?", Boolean.class, eventId);
    }

    private int attempts(String eventId) {
        return jdbcTemplate.queryForObject(
                "SELECT attempts FROM raw_events WHERE event_id = ?", Integer.class, eventId);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    @Nested
    @DisplayName("Deduplication")
    class DeduplicationTests {

        @Test
        @DisplayName("A listing.created event creates the listing once, redelivery is a duplicate")
        void testDuplicateDelivery() {
            printTestHeader("Duplicate Delivery");
            UUID listingId = UUID.randomUUID();
            RawEvent created = listingCreated(listingId, "Soroban workshop");

            assertEquals(IngestionResult.APPLIED, eventProcessor.ingest(created));
            assertEquals(IngestionResult.DUPLICATE, eventProcessor.ingest(created));

            Listing listing = concurrencyControl.getListing(listingId).orElseThrow();
            assertEquals(1, listing.getVersion());
            assertEquals(1, concurrencyControl.getHistory(listingId).size());
            assertEquals(created.getEventId(), concurrencyControl.getHistory(listingId).get(0).getSourceEventId());
            assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM raw_events", Integer.class));
        }

        @Test
        @DisplayName("Concurrent deliveries of one event apply it exactly once")
        void testConcurrentDelivery() throws InterruptedException {
            UUID listingId = UUID.randomUUID();
            RawEvent created = listingCreated(listingId, "Race");

            int threads = 6;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger applied = new AtomicInteger();
            AtomicInteger duplicates = new AtomicInteger();
            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        IngestionResult result = eventProcessor.ingest(created);
                        if (result == IngestionResult.APPLIED) {
                            applied.incrementAndGet();
                        } else if (result == IngestionResult.DUPLICATE) {
                            duplicates.incrementAndGet();
                        }
                    } catch (Exception e) {
                        System.out.println("Unexpected: " + e);
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            assertEquals(1, applied.get());
            assertEquals(threads - 1, duplicates.get());
            assertEquals(1, concurrencyControl.getHistory(listingId).size());
        }
    }

    @Nested
    @DisplayName("Validation and routing")
    class RoutingTests {

        @Test
        @DisplayName("Missing required fields are rejected before anything is stored")
        void testInvalidEvent() {
            RawEvent missingType = RawEvent.builder()
                    .eventId("evt-no-type").contract("GCONTRACT").blockNumber(1).timestamp(Instant.now()).build();
            RawEvent negativeBlock = RawEvent.builder()
                    .eventId("evt-neg").contract("GCONTRACT").type(EventTypes.LISTING_CREATED)
                    .blockNumber(-1).timestamp(Instant.now()).build();

            assertThrows(IllegalArgumentException.class, () -> eventProcessor.ingest(missingType));
            assertThrows(IllegalArgumentException.class, () -> eventProcessor.ingest(negativeBlock));
            assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM raw_events", Integer.class));
        }

        @Test
        @DisplayName("An event type without a handler is stored and marked processed")
        void testUnknownTypeSkipped() {
            RawEvent plain = event(EventTypes.STELLAR_TRANSACTION, "{\"hash\": \"abc\"}");

            assertEquals(IngestionResult.SKIPPED, eventProcessor.ingest(plain));
            assertTrue(isProcessed(plain.getEventId()));
        }

        @Test
        @DisplayName("Engagement events flow through to the read model")
        void testEngagementUpdatesReadModel() {
            UUID listingId = UUID.randomUUID();
            eventProcessor.ingest(listingCreated(listingId, "Meetup"));

            for (String user : new String[] {"alice", "bob", "carol"}) {
                eventProcessor.ingest(event(EventTypes.REGISTRATION_CONFIRMED,
                        "{\"listingId\": \"%s\", \"userId\": \"%s\"}".formatted(listingId, user)));
            }
            eventProcessor.ingest(event(EventTypes.ATTENDANCE_RECORDED,
                    "{\"listingId\": \"%s\", \"userId\": \"alice\"}".formatted(listingId)));

            var stats = materializedViewService.getStatistics(listingId).orElseThrow();
            assertEquals(3, stats.getRegisteredCount());
            assertEquals(1, stats.getAttendanceCount());
        }

        @Test
        @DisplayName("Deleting a listing voids its open bets")
        void testDeleteVoidsBets() {
            UUID listingId = UUID.randomUUID();
            UUID betId = UUID.randomUUID();
            eventProcessor.ingest(listingCreated(listingId, "Final"));
            eventProcessor.ingest(event(EventTypes.LEDGER_DEPOSIT, "{\"wallet\": \"GWALLET1\", \"amount\": \"20\"}"));
            eventProcessor.ingest(event(EventTypes.BET_PLACED, """
                    {"betId": "%s", "listingId": "%s", "wallet": "GWALLET1", "stake": "20", "odds": "1.5"}
                    """.formatted(betId, listingId)));

            RawEvent deleted = event(EventTypes.LISTING_DELETED, "{\"listingId\": \"%s\"}".formatted(listingId));
            assertEquals(IngestionResult.APPLIED, eventProcessor.ingest(deleted));

            assertTrue(concurrencyControl.getListing(listingId).orElseThrow().isDeleted());
            assertEquals(BetStatus.VOID, wageringService.findBet(betId).orElseThrow().getStatus());
        }
    }

    @Nested
    @DisplayName("Failure and reprocessing")
    class FailureTests {

        @Test
        @DisplayName("A failing mutation leaves the event unprocessed with its error recorded")
        void testFailureRecorded() {
            UUID listingId = UUID.randomUUID();
            RawEvent update = event(EventTypes.LISTING_UPDATED,
                    "{\"listingId\": \"%s\", \"title\": \"early\"}".formatted(listingId));

            assertEquals(IngestionResult.FAILED, eventProcessor.ingest(update));

            assertFalse(isProcessed(update.getEventId()));
            assertEquals(1, attempts(update.getEventId()));
            String error = jdbcTemplate.queryForObject(
                    "SELECT last_error FROM raw_events WHERE event_id = ?", String.class, update.getEventId());
            assertTrue(error.contains("ListingNotFoundException"), error);
            assertEquals(1, eventProcessor.countUnprocessed());
        }

        @Test
        @DisplayName("An out-of-order update succeeds on reprocessing once its listing exists")
        void testReprocessAfterDependencyArrives() {
            printTestHeader("Out-of-order Reprocessing");
            UUID listingId = UUID.randomUUID();
            RawEvent update = event(EventTypes.LISTING_UPDATED,
                    "{\"listingId\": \"%s\", \"title\": \"renamed\"}".formatted(listingId));
            assertEquals(IngestionResult.FAILED, eventProcessor.ingest(update));

            eventProcessor.ingest(listingCreated(listingId, "original"));
            int completed = eventProcessor.reprocessPending();

            assertEquals(1, completed);
            assertTrue(isProcessed(update.getEventId()));
            Listing listing = concurrencyControl.getListing(listingId).orElseThrow();
            assertEquals("renamed", listing.getTitle());
            assertEquals(2, listing.getVersion());
            assertEquals(0, eventProcessor.countUnprocessed());
        }

        @Test
        @DisplayName("A failed mutation rolls back every write it made")
        void testPartialWritesRolledBack() {
            UUID listingId = UUID.randomUUID();
            eventProcessor.ingest(listingCreated(listingId, "Stable"));

            RawEvent staleUpdate = event(EventTypes.LISTING_UPDATED,
                    "{\"listingId\": \"%s\", \"title\": \"stale\", \"expectedVersion\": 7}".formatted(listingId));
            assertEquals(IngestionResult.FAILED, eventProcessor.ingest(staleUpdate));

            assertEquals("Stable", concurrencyControl.getListing(listingId).orElseThrow().getTitle());
            assertEquals(1, concurrencyControl.getHistory(listingId).size());
            assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM outbox_events", Integer.class));
        }
    }
}
