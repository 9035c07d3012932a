package com.extrophi.token_ledger.ledger;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of a ledger entry.
 *
 * EARN entries are system-originated credits and have no source account.
 * TRANSFER and ATTRIBUTION entries always move tokens between two accounts.
 */
public enum TransactionKind {
    EARN("earn"),
    TRANSFER("transfer"),
    ATTRIBUTION("attribution");

    private final String dbValue;

    TransactionKind(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    public static TransactionKind fromDbValue(String value) {
        return fromValue(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown transaction kind: " + value));
    }

    /**
     * Case-insensitive lookup, used for query filters coming from callers.
     */
    public static Optional<TransactionKind> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(kind -> kind.dbValue.equalsIgnoreCase(value.trim()))
            .findFirst();
    }
}
