package com.extrophi.token_ledger.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point rules for $EXTROPY amounts: 8 fractional digits, never rounded.
 */
public final class TokenAmounts {

    public static final int SCALE = 8;
    public static final int PRECISION = 20;

    private TokenAmounts() {
    }

    /**
     * A valid amount is strictly positive and fits NUMERIC(20,8) without
     * losing digits.
     */
    public static boolean isValidAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            return false;
        }
        if (amount.stripTrailingZeros().scale() > SCALE) {
            return false;
        }
        return scaled(amount).precision() <= PRECISION;
    }

    /**
     * Whether a resulting balance still fits NUMERIC(20,8).
     */
    public static boolean isStorableBalance(BigDecimal balance) {
        return scaled(balance).precision() <= PRECISION;
    }

    /**
     * Rescales to {@link #SCALE}. Throws if digits would be lost.
     */
    public static BigDecimal scaled(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    public static String format(BigDecimal amount) {
        if (amount == null) {
            return null;
        }
        return scaled(amount).toPlainString();
    }
}
