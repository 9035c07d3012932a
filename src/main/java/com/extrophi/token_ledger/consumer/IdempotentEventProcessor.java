package com.extrophi.token_ledger.consumer;

import com.extrophi.token_ledger.ledger.LedgerError;
import com.extrophi.token_ledger.ledger.LedgerErrorKind;
import com.extrophi.token_ledger.ledger.LedgerException;
import com.extrophi.token_ledger.ledger.LedgerResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Processes each content event at most once per consumer group.
 *
 * The processed_events row and the ledger posting share one transaction,
 * so either both commit or neither does. A redelivered event finds the row
 * and is skipped; two instances racing on the same event collide on the
 * primary key and the loser rolls back its posting.
 *
 * Outcomes:
 * - PROCESSED: the ledger accepted the operation
 * - REJECTED: the ledger refused it (recorded, not retried)
 * - DUPLICATE: already handled earlier
 *
 * Storage faults are thrown so the message is redelivered.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final Clock clock;

    public enum Outcome {
        PROCESSED,
        REJECTED,
        DUPLICATE
    }

    @Transactional
    public Outcome processEvent(UUID eventId, String eventType,
                                String aggregateType, UUID aggregateId,
                                String consumerGroup, Supplier<LedgerResult<?>> handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping",
                    eventId, consumerGroup);
            return Outcome.DUPLICATE;
        }
        ProcessedContentEvent.EventKey key = new ProcessedContentEvent.EventKey(
            eventId, eventType, aggregateType, aggregateId, consumerGroup);

        LedgerResult<?> result = handler.get();

        if (result.isSuccess()) {
            repository.save(ProcessedContentEvent.processed(key, clock.instant()));
            log.debug("Successfully processed event {} by consumer group {}", eventId, consumerGroup);
            return Outcome.PROCESSED;
        }

        LedgerError error = result.getError();
        if (error.getKind() == LedgerErrorKind.STORAGE_FAULT) {
            log.error("Storage fault while processing event {}, leaving it for redelivery: {}",
                    eventId, error.getMessage());
            throw new LedgerException(error);
        }

        repository.save(ProcessedContentEvent.rejected(key, clock.instant(), error));
        log.warn("Event {} rejected by ledger: kind={}, message={}",
                eventId, error.getKind(), error.getMessage());
        return Outcome.REJECTED;
    }

    /**
     * Marks an event as skipped (not relevant to this consumer).
     * This prevents the event from being reprocessed.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }

        ProcessedContentEvent.EventKey key = new ProcessedContentEvent.EventKey(
            eventId, eventType, aggregateType, aggregateId, consumerGroup);
        repository.save(ProcessedContentEvent.skipped(key, clock.instant(), reason));

        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
