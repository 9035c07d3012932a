package com.extrophi.token_ledger.consumer.event;

import lombok.Value;

import java.util.UUID;

/**
 * A creator published a card. Earns the publish reward.
 */
@Value
public class CardPublishedEvent {
    public static final String EVENT_TYPE = "CardPublished";

    UUID eventId;
    UUID cardId;
    UUID userId;
    String title;
}
