package com.extrophi.token_ledger.consumer.event;

import com.extrophi.token_ledger.attribution.AttributionEvent;
import lombok.Value;

import java.util.UUID;

/**
 * A card (target) cited, remixed or replied to another card (source).
 */
@Value
public class AttributionCreatedEvent {
    public static final String EVENT_TYPE = "AttributionCreated";

    UUID eventId;
    UUID attributionId;
    UUID sourceCardId;
    UUID targetCardId;
    String attributionType;
    UUID sourceOwnerId;
    UUID targetOwnerId;
    String targetTitle;

    public AttributionEvent toAttributionEvent() {
        return AttributionEvent.builder()
            .attributionId(attributionId)
            .sourceContentId(sourceCardId)
            .targetContentId(targetCardId)
            .kind(attributionType)
            .sourceOwnerId(sourceOwnerId)
            .targetOwnerId(targetOwnerId)
            .targetTitle(targetTitle)
            .build();
    }
}
