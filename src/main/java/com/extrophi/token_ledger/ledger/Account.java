package com.extrophi.token_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A user's token account. The id is the user's id.
 *
 * lastEntryAt is the timestamp of the newest ledger entry touching the
 * account, or null if there is none yet.
 */
@Value
public class Account {
    UUID id;
    BigDecimal balance;
    Instant createdAt;
    Instant lastEntryAt;
}
