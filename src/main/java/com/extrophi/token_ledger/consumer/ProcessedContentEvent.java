package com.extrophi.token_ledger.consumer;

import com.extrophi.token_ledger.ledger.LedgerError;
import com.extrophi.token_ledger.ledger.LedgerErrorKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One row per content event this service has handled, whatever the outcome.
 *
 * A row exists only once the ledger side of the event has committed (or was
 * refused), so its presence is what makes redelivery a no-op.
 */
@Entity
@Table(name = "processed_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedContentEvent {

    public enum Result {
        PROCESSED,
        REJECTED,
        SKIPPED
    }

    @Id
    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "aggregate_type", nullable = false, length = 100)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false)
    private UUID aggregateId;

    @Column(name = "consumer_group", nullable = false, length = 100)
    private String consumerGroup;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_result", nullable = false, length = 50)
    private Result result;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", length = 50)
    private LedgerErrorKind errorKind;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    private ProcessedContentEvent(EventKey key, Instant processedAt, Result result,
                                  LedgerErrorKind errorKind, String errorMessage) {
        this.eventId = key.eventId();
        this.eventType = key.eventType();
        this.aggregateType = key.aggregateType();
        this.aggregateId = key.aggregateId();
        this.consumerGroup = key.consumerGroup();
        this.processedAt = processedAt;
        this.result = result;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    static ProcessedContentEvent processed(EventKey key, Instant at) {
        return new ProcessedContentEvent(key, at, Result.PROCESSED, null, null);
    }

    static ProcessedContentEvent rejected(EventKey key, Instant at, LedgerError error) {
        return new ProcessedContentEvent(key, at, Result.REJECTED, error.getKind(),
            error.getKind() + ": " + error.getMessage());
    }

    static ProcessedContentEvent skipped(EventKey key, Instant at, String reason) {
        return new ProcessedContentEvent(key, at, Result.SKIPPED, null, reason);
    }

    /**
     * Identifies an event delivery: which event, what it is about, and which
     * consumer group handled it.
     */
    record EventKey(UUID eventId, String eventType, String aggregateType,
                    UUID aggregateId, String consumerGroup) {
    }
}
