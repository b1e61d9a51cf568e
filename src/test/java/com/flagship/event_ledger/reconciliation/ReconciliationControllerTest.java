package com.flagship.event_ledger.reconciliation;

import com.flagship.event_ledger.support.TestDatabase;
import com.flagship.event_ledger.wagering.WageringService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.UUID;

import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ReconciliationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private WageringService wageringService;

    @Autowired
    private ReconciliationScheduler scheduler;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        TestDatabase.clean(jdbcTemplate);
        scheduler.setEnabled(true);
    }

    @Test
    @DisplayName("POST /run returns a completed MANUAL report")
    void testManualRun() throws Exception {
        wageringService.placeBet(UUID.randomUUID(), UUID.randomUUID(), "GADMIN", BigDecimal.TEN, new BigDecimal("2"));

        mockMvc.perform(post("/admin/reconciliation/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type", is("MANUAL")))
                .andExpect(jsonPath("$.status", is("COMPLETED")))
                .andExpect(jsonPath("$.totalInconsistencies", is(2)));
    }

    @Test
    @DisplayName("Unknown report id is a 404 with code NOT_FOUND")
    void testReportNotFound() throws Exception {
        mockMvc.perform(get("/admin/reconciliation/reports/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code", is("NOT_FOUND")));
    }

    @Test
    @DisplayName("Invalid paging is a 400")
    void testInvalidPaging() throws Exception {
        mockMvc.perform(get("/admin/reconciliation/reports").param("page", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("INVALID_REQUEST")));
    }

    @Test
    @DisplayName("GET /check/{rule} runs a single rule")
    void testSingleRuleCheck() throws Exception {
        wageringService.placeBet(UUID.randomUUID(), UUID.randomUUID(), "GCHECK", BigDecimal.ONE, new BigDecimal("2"));

        mockMvc.perform(get("/admin/reconciliation/check/{rule}", "negative-balances"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(1)))
                .andExpect(jsonPath("$.inconsistencies[0].kind", is("NEGATIVE_BALANCE")))
                .andExpect(jsonPath("$.inconsistencies[0].details.accountNumber", is("GCHECK")));

    }

    @Test
    @DisplayName("GET /check/{rule} for an unknown rule is a 404 with code NOT_FOUND")
    void testUnknownRuleCheck() throws Exception {
        mockMvc.perform(get("/admin/reconciliation/check/{rule}", "no-such-rule"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code", is("NOT_FOUND")));
    }

    @Test
    @DisplayName("A limit above 100 is rejected before reaching the service")
    void testLimitTooLarge() throws Exception {
        mockMvc.perform(get("/admin/reconciliation/reports").param("limit", "101"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("INVALID_REQUEST")))
                .andExpect(jsonPath("$.details.limit").exists());
    }

    @Test
    @DisplayName("Scheduler status exposes enabled, isRunning and isQuickCheckRunning")
    void testSchedulerStatusAndToggle() throws Exception {
        mockMvc.perform(get("/admin/reconciliation/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled", is(true)))
                .andExpect(jsonPath("$.isRunning", is(false)))
                .andExpect(jsonPath("$.isQuickCheckRunning", is(false)));

        mockMvc.perform(put("/admin/reconciliation/scheduler").param("enabled", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled", is(false)));
    }

    @Test
    @DisplayName("Summary is all zeros before the first report")
    void testEmptySummary() throws Exception {
        mockMvc.perform(get("/admin/reconciliation/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalInconsistencies", is(0)))
                .andExpect(jsonPath("$.counts.NEGATIVE_BALANCE", is(0)));
    }
}
