package com.extrophi.token_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Request to credit system-originated tokens to an account.
 */
@Value
@Builder(toBuilder = true)
public class AwardCommand {
    UUID toAccountId;
    BigDecimal amount;
    String reason;
    UUID contentId;
    Map<String, String> metadata;
    String idempotencyKey;
}
