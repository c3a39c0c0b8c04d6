package com.flagship.mining_ledger.health;

import com.flagship.mining_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Public health check for load balancers. The ledger is unusable without its
 * database, so a failed round trip reports DOWN with 503. The outbox backlog is
 * informational only.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;
    private final OutboxService outboxService;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now(clock).toString());

        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            body.put("database", "UP");
            body.put("outbox_backlog", outboxService.countUnpublished());
        } catch (RuntimeException e) {
            log.warn("Health check database round trip failed: {}", e.getMessage());
            body.put("database", "DOWN");
            body.put("status", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }

        body.put("status", "UP");
        return ResponseEntity.ok(body);
    }
}
