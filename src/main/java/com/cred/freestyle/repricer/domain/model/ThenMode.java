package com.cred.freestyle.repricer.domain.model;

import java.util.Locale;

/**
 * How a rule's {@code thenValue} is interpreted.
 *
 * @author Repricer Team
 */
public enum ThenMode {

    /**
     * Value is an amount in the shop currency. Stored as "absolute" or "fixed".
     */
    FIXED,

    /**
     * Value is a percentage of the current price.
     */
    PERCENTAGE;

    /**
     * Resolve a stored mode code; anything that is not a percentage is treated as a fixed amount.
     */
    public static ThenMode fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("percentage") || normalized.equals("percent") || normalized.equals("pct")) {
                return PERCENTAGE;
            }
        }
        return FIXED;
    }
}
