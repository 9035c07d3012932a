package com.extrophi.token_ledger.attribution;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of attribution between content items and the fixed $EXTROPY reward
 * each one pays to the original creator.
 *
 * The reward table is part of the public contract and is not configurable.
 */
public enum AttributionKind {
    CITATION(new BigDecimal("0.10000000")),
    REMIX(new BigDecimal("0.50000000")),
    REPLY(new BigDecimal("0.05000000"));

    private final BigDecimal reward;

    AttributionKind(BigDecimal reward) {
        this.reward = reward;
    }

    public BigDecimal getReward() {
        return reward;
    }

    /**
     * Case-insensitive lookup. Empty for anything not in the table.
     */
    public static Optional<AttributionKind> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
            .filter(kind -> kind.name().equalsIgnoreCase(normalized))
            .findFirst();
    }
}
