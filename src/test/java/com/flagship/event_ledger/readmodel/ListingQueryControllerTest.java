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
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ListingQueryControllerTest {

    @Autowired
    private MockMvc mockMvc;

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

    private UUID createListing(String title) {
        UUID id = UUID.randomUUID();
        concurrencyControl.applyMutation(id, 0, ListingMutation.create(ListingDraft.builder()
                .title(title).organizerId("org-1").organizerName("Stellar Meetups")
                .capacity(4).status(ListingStatus.PUBLISHED).build()));
        return id;
    }

    @Test
    @DisplayName("Statistics of a listing include counts and rates")
    void testStatistics() throws Exception {
        UUID id = createListing("Workshop");
        engagementService.confirmRegistration(id, "alice");

        mockMvc.perform(get("/api/listings/{id}/statistics", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title", is("Workshop")))
                .andExpect(jsonPath("$.registeredCount", is(1)))
                .andExpect(jsonPath("$.registrationRate", is(25.00)))
                .andExpect(jsonPath("$.attendanceRate", nullValue()));
    }

    @Test
    @DisplayName("Unknown listing is a 404 with code NOT_FOUND")
    void testUnknownListing() throws Exception {
        mockMvc.perform(get("/api/listings/{id}/statistics", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code", is("NOT_FOUND")));
    }

    @Test
    @DisplayName("Top listings are ordered by registrations and the limit is validated")
    void testTop() throws Exception {
        UUID quiet = createListing("Quiet");
        UUID busy = createListing("Busy");
        engagementService.confirmRegistration(busy, "alice");
        engagementService.confirmRegistration(busy, "bob");
        engagementService.confirmRegistration(quiet, "carol");

        mockMvc.perform(get("/api/listings/top").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id", is(busy.toString())));

        mockMvc.perform(get("/api/listings/top").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("INVALID_REQUEST")))
                .andExpect(jsonPath("$.details.limit").exists());
    }

    @Test
    @DisplayName("A malformed listing id is a 400")
    void testMalformedId() throws Exception {
        mockMvc.perform(get("/api/listings/{id}/statistics", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("INVALID_REQUEST")));
    }
}
