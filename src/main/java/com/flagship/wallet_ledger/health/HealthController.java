package com.flagship.wallet_ledger.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness probe. Unlike the Actuator health endpoint, this does not
 * require authorization. Reports DOWN unless the wallet tables are reachable.
 */
@RestController
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;

    public HealthController(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean ledgerHealthy = checkLedgerTables();
        response.put("database", ledgerHealthy ? "UP" : "DOWN");

        if (!ledgerHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkLedgerTables() {
        try {
            jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM (SELECT 1 FROM wallets LIMIT 1) w", Integer.class);
            jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM (SELECT 1 FROM wallet_transactions LIMIT 1) t", Integer.class);
            return true;
        } catch (DataAccessException e) {
            log.warn("Health check failed: {}", e.getMessage());
            return false;
        }
    }
}
