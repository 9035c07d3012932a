package com.extrophi.token_ledger.consumer;

import com.extrophi.token_ledger.consumer.event.AttributionCreatedEvent;
import com.extrophi.token_ledger.consumer.event.CardPublishedEvent;
import com.extrophi.token_ledger.consumer.event.UserRegisteredEvent;
import com.extrophi.token_ledger.ledger.LedgerResult;
import com.extrophi.token_ledger.observability.CorrelationContext;
import com.extrophi.token_ledger.observability.TokenMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Kafka consumer for content events.
 *
 * This consumer:
 * 1. Receives events from the content-events topic
 * 2. Reads the envelope (eventId, eventType) from the JSON payload
 * 3. Routes the event to ContentEventHandler through the idempotent processor
 * 4. Acknowledges manually once the outcome is committed
 *
 * Unparseable messages and unknown event types are acknowledged and
 * skipped. Ledger refusals are recorded and acknowledged. Anything else
 * (storage faults included) is rethrown without acknowledging, so the
 * message is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ContentEventConsumer {

    static final String CONSUMER_GROUP = "token-ledger-content-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final ContentEventHandler eventHandler;
    private final ObjectMapper objectMapper;
    private final TokenMetrics metrics;

    @KafkaListener(
        topics = "${kafka.topic.content-events:content-events}",
        groupId = "${spring.kafka.consumer.group-id:token-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        CorrelationContext.begin(correlationIdOf(record));

        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        try {
            EventEnvelope envelope = parseEnvelope(record.value());

            if (envelope == null) {
                log.warn("Could not parse event, acknowledging to skip: {}", record.value());
                ack.acknowledge();
                return;
            }

            IdempotentEventProcessor.Outcome outcome = routeEvent(envelope, record.value());
            ack.acknowledge();

            if (outcome != null) {
                metrics.recordEventProcessed(envelope.eventType(), outcome.name());
                log.info("Handled event: type={}, eventId={}, outcome={}",
                        envelope.eventType(), envelope.eventId(), outcome);
            }

        } catch (IllegalArgumentException e) {
            log.warn("Malformed event at offset {}, acknowledging to skip: {}", record.offset(), e.getMessage());
            ack.acknowledge();
        } catch (Exception e) {
            log.error("Error processing message at offset {}: {}",
                    record.offset(), e.getMessage(), e);
            // Not acknowledged, the message will be redelivered
            throw e;
        } finally {
            CorrelationContext.end();
        }
    }

    /**
     * @return the outcome, or null if the event type is not ours
     */
    private IdempotentEventProcessor.Outcome routeEvent(EventEnvelope envelope, String rawPayload) {
        return switch (envelope.eventType()) {
            case UserRegisteredEvent.EVENT_TYPE -> {
                UserRegisteredEvent event = deserialize(rawPayload, UserRegisteredEvent.class);
                yield process(envelope, "User", event.getUserId(), () -> eventHandler.onUserRegistered(event));
            }
            case CardPublishedEvent.EVENT_TYPE -> {
                CardPublishedEvent event = deserialize(rawPayload, CardPublishedEvent.class);
                yield process(envelope, "Card", event.getCardId(), () -> eventHandler.onCardPublished(event));
            }
            case AttributionCreatedEvent.EVENT_TYPE -> {
                AttributionCreatedEvent event = deserialize(rawPayload, AttributionCreatedEvent.class);
                UUID aggregateId = event.getAttributionId() != null ? event.getAttributionId() : envelope.eventId();
                yield process(envelope, "Attribution", aggregateId, () -> eventHandler.onAttributionCreated(event));
            }
            default -> {
                log.debug("Unknown event type: {}, skipping", envelope.eventType());
                eventProcessor.skipEvent(
                    envelope.eventId(), envelope.eventType(),
                    "Unknown", envelope.eventId(),
                    CONSUMER_GROUP, "Unknown event type"
                );
                yield null;
            }
        };
    }

    private IdempotentEventProcessor.Outcome process(EventEnvelope envelope, String aggregateType,
                                                     UUID aggregateId, Supplier<LedgerResult<?>> handler) {
        if (aggregateId == null) {
            throw new IllegalArgumentException(
                "Event " + envelope.eventId() + " of type " + envelope.eventType() + " has no aggregate id");
        }
        return eventProcessor.processEvent(
            envelope.eventId(), envelope.eventType(),
            aggregateType, aggregateId,
            CONSUMER_GROUP, handler
        );
    }

    private EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.hasNonNull("eventId") || !node.hasNonNull("eventType")) {
                return null;
            }
            UUID eventId = UUID.fromString(node.get("eventId").asText());
            return new EventEnvelope(eventId, node.get("eventType").asText());

        } catch (Exception e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> clazz) {
        try {
            return objectMapper.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize event: " + e.getMessage(), e);
        }
    }

    private String correlationIdOf(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        String candidate = header == null || header.value() == null
            ? null
            : new String(header.value(), StandardCharsets.UTF_8);
        return CorrelationContext.resolve(candidate);
    }

    private record EventEnvelope(UUID eventId, String eventType) {}
}
