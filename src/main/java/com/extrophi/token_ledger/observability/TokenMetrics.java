package com.extrophi.token_ledger.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.awards: awards by status
 * - ledger.transfers: transfers by kind and status
 * - ledger.attribution.rewards: attribution rewards by attribution kind and status
 * - ledger.latency: posting latency by operation
 * - idempotency.cache: idempotency key hits and misses
 * - ledger.reconciliation.discrepancies: accounts whose balance disagrees with the ledger
 *
 * Status tags are "success" or the lower-cased error kind.
 */
@Component
public class TokenMetrics {

    private final MeterRegistry registry;
    private final AtomicLong reconciliationDiscrepancies = new AtomicLong(0);

    public TokenMetrics(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder("ledger.reconciliation.discrepancies", reconciliationDiscrepancies, AtomicLong::get)
                .description("Accounts whose stored balance differs from the ledger sum")
                .register(registry);
    }

    public void recordAward(String status) {
        registry.counter("ledger.awards",
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordTransfer(String kind, String status) {
        registry.counter("ledger.transfers",
                "kind", sanitizeTag(kind),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordAttributionReward(String attributionKind, String status) {
        registry.counter("ledger.attribution.rewards",
                "attribution_kind", sanitizeTag(attributionKind),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordEventProcessed(String eventType, String result) {
        registry.counter("consumer.events.processed",
                "event_type", sanitizeTag(eventType),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void setReconciliationDiscrepancies(long count) {
        reconciliationDiscrepancies.set(count);
    }

    public long getReconciliationDiscrepancies() {
        return reconciliationDiscrepancies.get();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
