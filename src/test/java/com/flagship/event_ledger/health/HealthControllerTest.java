package com.flagship.event_ledger.health;

import com.flagship.event_ledger.ingestion.EventProcessor;
import com.flagship.event_ledger.ingestion.RawEvent;
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

import java.time.Instant;

import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private EventProcessor eventProcessor;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        TestDatabase.clean(jdbcTemplate);
    }

    @Test
    @DisplayName("Health reports the database, a stopped listener and the unprocessed backlog")
    void testHealth() throws Exception {
        eventProcessor.ingest(RawEvent.builder()
                .eventId("evt-pending")
                .contract("GCONTRACT")
                .type("listing.updated")
                .payload("{\"listingId\":\"6f1c1c9e-6a55-4c36-9b8e-0b0f5f0b3a11\",\"title\":\"Later\"}")
                .blockNumber(7)
                .timestamp(Instant.parse("2026-01-01T00:00:00Z"))
                .build());

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("UP")))
                .andExpect(jsonPath("$.database", is("UP")))
                .andExpect(jsonPath("$.listener", is("STOPPED")))
                .andExpect(jsonPath("$.unprocessedEvents", is(1)));
    }
}
