package com.flagship.event_ledger.health;

import com.flagship.event_ledger.ingestion.EventProcessor;
import com.flagship.event_ledger.ingestion.listener.BlockchainListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final BlockchainListener listener;
    private final EventProcessor eventProcessor;
    private final Clock clock;

    public HealthController(DataSource dataSource,
                            BlockchainListener listener,
                            EventProcessor eventProcessor,
                            Clock clock) {
        this.dataSource = dataSource;
        this.listener = listener;
        this.eventProcessor = eventProcessor;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("listener", listener.isListening() ? "LISTENING" : "STOPPED");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        response.put("unprocessedEvents", eventProcessor.countUnprocessed());
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
