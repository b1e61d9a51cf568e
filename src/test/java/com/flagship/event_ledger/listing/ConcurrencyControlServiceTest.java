package com.flagship.event_ledger.listing;

import com.flagship.event_ledger.outbox.OutboxEvent;
import com.flagship.event_ledger.outbox.OutboxService;
import com.flagship.event_ledger.readmodel.ListingStatistics;
import com.flagship.event_ledger.readmodel.MaterializedViewService;
import com.flagship.event_ledger.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Optimistic concurrency on the listing write model: every accepted change bumps the
 * version by one and writes exactly one version-log entry and one outbox event.
 */
@SpringBootTest
@ActiveProfiles("test")
class ConcurrencyControlServiceTest {

    @Autowired
    private ConcurrencyControlService service;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private MaterializedViewService materializedViewService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        TestDatabase.clean(jdbcTemplate);
    }

    private static ListingDraft draft(String title) {
        return ListingDraft.builder()
                .title(title)
                .organizerId("org-1")
                .organizerName("Stellar Meetups")
                .capacity(100)
                .status(ListingStatus.PUBLISHED)
                .build();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @Test
    @DisplayName("Create writes version 1, its log entry, an outbox event and the read row")
    void testCreate() {
        UUID id = UUID.randomUUID();

        Listing created = service.applyMutation(id, 0, ListingMutation.create(draft("Launch party")));

        assertEquals(1, created.getVersion());
        List<ListingVersion> history = service.getHistory(id);
        assertEquals(1, history.size());
        assertEquals(0, history.get(0).getFromVersion());
        assertEquals(1, history.get(0).getToVersion());
        assertTrue(history.get(0).getSnapshot().contains("Launch party"));

        List<OutboxEvent> events = outboxService.getEventsForAggregate(id);
        assertEquals(1, events.size());
        assertEquals("ListingCreated", events.get(0).getEventType());

        ListingStatistics stats = materializedViewService.getStatistics(id).orElseThrow();
        assertEquals("Launch party", stats.getTitle());
        assertEquals(1, stats.getSourceVersion());
    }

    @Test
    @DisplayName("Update with a stale version is rejected and leaves no trace")
    void testStaleVersionRejected() {
        printTestHeader("Stale Version");
        UUID id = UUID.randomUUID();
        service.applyMutation(id, 0, ListingMutation.create(draft("v1")));
        service.applyMutation(id, 1, ListingMutation.update(ListingDraft.builder().title("v2").build()));
        service.applyMutation(id, 2, ListingMutation.update(ListingDraft.builder().title("v3").build()));
        service.applyMutation(id, 3, ListingMutation.update(ListingDraft.builder().title("v4").build()));

        ConcurrencyConflictException e = assertThrows(ConcurrencyConflictException.class,
                () -> service.applyMutation(id, 3, ListingMutation.update(ListingDraft.builder().title("late").build())));
        printOutput("Conflict", e.getMessage());

        assertEquals(3, e.getExpectedVersion());
        assertEquals(4L, e.getActualVersion());
        Listing current = service.getListing(id).orElseThrow();
        assertEquals(4, current.getVersion());
        assertEquals("v4", current.getTitle());
        assertEquals(4, service.getHistory(id).size());
        assertEquals(4, outboxService.getEventsForAggregate(id).size());
    }

    @Test
    @DisplayName("Creating an existing listing is a conflict")
    void testDuplicateCreate() {
        UUID id = UUID.randomUUID();
        service.applyMutation(id, 0, ListingMutation.create(draft("first")));

        assertThrows(ConcurrencyConflictException.class,
                () -> service.applyMutation(id, 0, ListingMutation.create(draft("second"))));
        assertEquals("first", service.getListing(id).orElseThrow().getTitle());
    }

    @Test
    @DisplayName("Updating a missing listing fails with ListingNotFoundException")
    void testUpdateMissing() {
        assertThrows(ListingNotFoundException.class, () -> service.applyMutation(
                UUID.randomUUID(), 1, ListingMutation.update(ListingDraft.builder().title("x").build())));
    }

    @Test
    @DisplayName("Delete is soft: the row stays, flagged deleted, and cannot be updated")
    void testSoftDelete() {
        UUID id = UUID.randomUUID();
        service.applyMutation(id, 0, ListingMutation.create(draft("to delete")));

        Listing deleted = service.applyMutation(id, 1, ListingMutation.delete());

        assertTrue(deleted.isDeleted());
        assertEquals(2, deleted.getVersion());
        assertTrue(service.getListing(id).orElseThrow().isDeleted());
        assertThrows(IllegalStateException.class, () -> service.applyMutation(
                id, 2, ListingMutation.update(ListingDraft.builder().title("revive").build())));
    }

    @Test
    @DisplayName("Invalid listing fields are rejected without a version entry")
    void testInvalidCreate() {
        UUID id = UUID.randomUUID();
        ListingDraft invalid = ListingDraft.builder().title("no organizer").capacity(10).build();

        assertThrows(IllegalArgumentException.class,
                () -> service.applyMutation(id, 0, ListingMutation.create(invalid)));
        assertTrue(service.getListing(id).isEmpty());
        assertTrue(service.getHistory(id).isEmpty());
    }

    @Test
    @DisplayName("Concurrent writers at the same version: exactly one wins")
    void testConcurrentUpdates() throws InterruptedException {
        printTestHeader("Concurrent Updates");
        UUID id = UUID.randomUUID();
        service.applyMutation(id, 0, ListingMutation.create(draft("contested")));

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        AtomicInteger otherErrors = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            String title = "writer-" + i;
            executor.submit(() -> {
                try {
                    start.await();
                    service.applyMutation(id, 1, ListingMutation.update(ListingDraft.builder().title(title).build()));
                    successes.incrementAndGet();
                } catch (ConcurrencyConflictException e) {
                    conflicts.incrementAndGet();
                } catch (Exception e) {
                    otherErrors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Successes", successes.get());
        printOutput("Conflicts", conflicts.get());
        assertEquals(1, successes.get());
        assertEquals(threads - 1, conflicts.get());
        assertEquals(0, otherErrors.get());
        assertEquals(2, service.getListing(id).orElseThrow().getVersion());
        assertEquals(2, service.getHistory(id).size());
    }

    @Test
    @DisplayName("Bulk create applies valid items and reports conflicts and failures per item")
    void testBulkCreatePartialSuccess() {
        UUID existing = UUID.randomUUID();
        service.applyMutation(existing, 0, ListingMutation.create(draft("already here")));

        UUID fresh1 = UUID.randomUUID();
        UUID fresh2 = UUID.randomUUID();
        UUID invalid = UUID.randomUUID();
        BulkCreateResult result = service.bulkCreate(List.of(
                new BulkCreateItem(fresh1, draft("one")),
                new BulkCreateItem(existing, draft("dup")),
                new BulkCreateItem(invalid, ListingDraft.builder().title("bad").organizerId("o").capacity(0).build()),
                new BulkCreateItem(fresh2, draft("two"))
        ), "evt-bulk-1");

        assertEquals(4, result.getRequested());
        assertEquals(List.of(fresh1, fresh2), result.getCreatedIds());
        assertEquals(1, result.getConflicts().size());
        assertEquals(existing, result.getConflicts().get(0).getId());
        assertEquals(1, result.getFailures().size());
        assertEquals(invalid, result.getFailures().get(0).getId());
        assertFalse(result.isFullySuccessful());

        assertEquals(MutationOperation.BULK_CREATE, service.getHistory(fresh1).get(0).getOperation());
        assertEquals("evt-bulk-1", service.getHistory(fresh2).get(0).getSourceEventId());
        assertEquals("already here", service.getListing(existing).orElseThrow().getTitle());
        assertTrue(service.getListing(invalid).isEmpty());
    }
}
