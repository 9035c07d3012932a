package com.extrophi.token_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Request to move tokens from one account to another.
 *
 * A non-null attributionId makes the resulting entry an ATTRIBUTION entry.
 */
@Value
@Builder(toBuilder = true)
public class TransferCommand {
    UUID fromAccountId;
    UUID toAccountId;
    BigDecimal amount;
    String reason;
    UUID attributionId;
    Map<String, String> metadata;
    String idempotencyKey;

    public TransactionKind kind() {
        return attributionId != null ? TransactionKind.ATTRIBUTION : TransactionKind.TRANSFER;
    }
}
