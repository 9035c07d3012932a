package com.extrophi.token_ledger.ledger;

import lombok.Getter;

/**
 * Raised when a caller unwraps a failed {@link LedgerResult}.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerError error;

    public LedgerException(LedgerError error) {
        super(error.getMessage());
        this.error = error;
    }

    public LedgerErrorKind getKind() {
        return error.getKind();
    }
}
