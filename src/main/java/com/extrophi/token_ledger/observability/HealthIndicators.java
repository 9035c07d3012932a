package com.extrophi.token_ledger.observability;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the token ledger.
 */
public class HealthIndicators {

    /**
     * Ledger integrity: DOWN while the last reconciliation found mismatched balances.
     */
    @Component("ledgerIntegrityHealth")
    public static class LedgerIntegrityHealthIndicator implements HealthIndicator {

        private final TokenMetrics tokenMetrics;

        public LedgerIntegrityHealthIndicator(TokenMetrics tokenMetrics) {
            this.tokenMetrics = tokenMetrics;
        }

        @Override
        public Health health() {
            long discrepancies = tokenMetrics.getReconciliationDiscrepancies();
            Health.Builder builder = discrepancies == 0 ? Health.up() : Health.down();
            return builder
                    .withDetail("discrepancies", discrepancies)
                    .build();
        }
    }

    /**
     * Health indicator for Redis connectivity.
     * Redis only backs the idempotency fast path, so failure is DEGRADED, not DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up()
                                .withDetail("response", result)
                                .build();
                    }
                    return degraded("Unexpected ping response: " + result);
                }

            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Idempotency keys fall back to the ledger without Redis")
                    .build();
        }
    }
}
