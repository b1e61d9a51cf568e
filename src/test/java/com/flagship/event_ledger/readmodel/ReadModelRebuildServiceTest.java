package com.flagship.event_ledger.readmodel;

import com.flagship.event_ledger.engagement.EngagementService;
import com.flagship.event_ledger.listing.ConcurrencyControlService;
import com.flagship.event_ledger.listing.ListingDraft;
import com.flagship.event_ledger.listing.ListingMutation;
import com.flagship.event_ledger.listing.ListingStatus;
import com.flagship.event_ledger.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class ReadModelRebuildServiceTest {

    @Autowired
    private ReadModelRebuildService rebuildService;

    @Autowired
    private MaterializedViewService materializedViewService;

    @Autowired
    private ConcurrencyControlService concurrencyControl;

    @Autowired
    private EngagementService engagementService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        TestDatabase.clean(jdbcTemplate);
    }

    @Test
    @DisplayName("Wiping the read model and rebuilding from the version log restores every row")
    void testRebuildRestoresReadModel() {
        UUID renamed = UUID.randomUUID();
        UUID deleted = UUID.randomUUID();
        ListingDraft base = ListingDraft.builder()
                .title("Original").organizerId("org").organizerName("Org").capacity(20)
                .status(ListingStatus.PUBLISHED).build();
        concurrencyControl.applyMutation(renamed, 0, ListingMutation.create(base));
        concurrencyControl.applyMutation(renamed, 1, ListingMutation.update(ListingDraft.builder().title("Renamed").build()));
        concurrencyControl.applyMutation(deleted, 0, ListingMutation.create(base));
        concurrencyControl.applyMutation(deleted, 1, ListingMutation.delete());
        engagementService.confirmRegistration(renamed, "alice");

        jdbcTemplate.update("DELETE FROM listings_read");
        assertTrue(materializedViewService.getStatistics(renamed).isEmpty());

        int rebuilt = rebuildService.rebuildFromVersionLog();

        assertEquals(2, rebuilt);
        ListingStatistics restored = materializedViewService.getStatistics(renamed).orElseThrow();
        assertEquals("Renamed", restored.getTitle());
        assertEquals(2, restored.getSourceVersion());
        assertEquals(1, restored.getRegisteredCount());
        Boolean isDeleted = jdbcTemplate.queryForObject(
                "SELECT is_deleted FROM listings_read WHERE id = ?", Boolean.class, deleted);
        assertTrue(isDeleted);
    }

    @Test
    @DisplayName("Rebuilding twice gives the same result")
    void testRebuildIdempotent() {
        UUID id = UUID.randomUUID();
        concurrencyControl.applyMutation(id, 0, ListingMutation.create(ListingDraft.builder()
                .title("Once").organizerId("org").capacity(5).build()));

        rebuildService.rebuildFromVersionLog();
        rebuildService.rebuildFromVersionLog();

        assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM listings_read", Integer.class));
        assertEquals("Once", materializedViewService.getStatistics(id).orElseThrow().getTitle());
    }
}
