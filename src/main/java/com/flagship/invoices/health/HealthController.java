package com.flagship.invoices.health;

import com.flagship.invoices.observability.OutboxMetrics;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness/readiness endpoint that does not go through Actuator.
 * Only the database decides UP or DOWN. Outbox figures come from the last metrics
 * refresh and are informational.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final OutboxMetrics outboxMetrics;

    public HealthController(DataSource dataSource, OutboxMetrics outboxMetrics) {
        this.dataSource = dataSource;
        this.outboxMetrics = outboxMetrics;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("outboxBacklog", outboxMetrics.getBacklogSize());
        response.put("outboxDeadLetters", outboxMetrics.getDeadLetterCount());

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
