package com.extrophi.token_ledger.ledger;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One immutable row of the token ledger.
 *
 * Key invariants:
 * - fromAccountId and fromBalanceAfter are null exactly for EARN entries
 * - amount is strictly positive, scale 8
 * - the recorded balances are the committed balances of the same transaction
 *
 * sequenceNumber is assigned by the database on append and breaks ties
 * between entries sharing a timestamp.
 */
@Value
@Builder
public class LedgerEntry {
    UUID id;
    @With
    Long sequenceNumber;
    UUID fromAccountId;
    UUID toAccountId;
    BigDecimal amount;
    TransactionKind kind;
    UUID attributionId;
    UUID contentId;
    String reason;
    BigDecimal fromBalanceAfter;
    BigDecimal toBalanceAfter;
    Map<String, String> metadata;
    String idempotencyKey;
    Instant createdAt;
}
