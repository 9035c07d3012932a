package com.extrophi.token_ledger.consumer.event;

import lombok.Value;

import java.util.UUID;

/**
 * A user signed up; their token account should exist from now on.
 */
@Value
public class UserRegisteredEvent {
    public static final String EVENT_TYPE = "UserRegistered";

    UUID eventId;
    UUID userId;
}
