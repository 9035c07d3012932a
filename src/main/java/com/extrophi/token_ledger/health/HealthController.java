package com.extrophi.token_ledger.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness probe for the token service: 200 while the ledger tables are
 * readable, 503 otherwise. Redis and Kafka are left to /actuator/health.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean ledgerReadable = ledgerReadable();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", ledgerReadable ? "UP" : "DOWN");
        body.put("service", "token-ledger");
        body.put("database", ledgerReadable ? "UP" : "DOWN");
        body.put("timestamp", clock.instant().toString());

        HttpStatus status = ledgerReadable ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(body);
    }

    private boolean ledgerReadable() {
        try {
            jdbcTemplate.queryForList("SELECT 1 FROM ledger_entries LIMIT 1");
            jdbcTemplate.queryForList("SELECT 1 FROM accounts LIMIT 1");
            return true;
        } catch (DataAccessException e) {
            log.warn("Health check could not read the ledger: {}", e.getMessage());
            return false;
        }
    }
}
