package com.extrophi.token_ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * An account whose stored balance differs from the sum of its ledger entries.
 */
@Value
public class BalanceDiscrepancy {
    UUID accountId;
    BigDecimal storedBalance;
    BigDecimal ledgerBalance;

    public BigDecimal getDifference() {
        return storedBalance.subtract(ledgerBalance);
    }
}
