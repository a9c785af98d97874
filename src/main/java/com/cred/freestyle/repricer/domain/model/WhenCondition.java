package com.cred.freestyle.repricer.domain.model;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Inventory conditions a rule can be guarded by.
 *
 * The "_pct" variants compare the raw inventory quantity against the threshold exactly like their
 * absolute counterparts; there is no reference quantity to take a percentage of.
 *
 * @author Repricer Team
 */
public enum WhenCondition {

    LESS_THAN_ABS(Family.LESS_THAN),
    LESS_THAN_PCT(Family.LESS_THAN),
    GREATER_THAN_ABS(Family.GREATER_THAN),
    GREATER_THAN_PCT(Family.GREATER_THAN),
    EQUALS(Family.EQUALS),
    UNKNOWN(Family.OTHER);

    /**
     * Condition family used by the prioritizer to compare thresholds of related rules.
     */
    public enum Family {
        LESS_THAN,
        GREATER_THAN,
        EQUALS,
        OTHER
    }

    private final Family family;

    WhenCondition(Family family) {
        this.family = family;
    }

    public Family getFamily() {
        return family;
    }

    /**
     * Evaluate this condition against an inventory quantity.
     * UNKNOWN never matches.
     *
     * @param inventory Current inventory quantity
     * @param threshold Rule threshold
     * @return true if the condition holds
     */
    public boolean matches(int inventory, BigDecimal threshold) {
        int cmp = BigDecimal.valueOf(inventory).compareTo(threshold);
        switch (family) {
            case LESS_THAN:
                return cmp < 0;
            case GREATER_THAN:
                return cmp > 0;
            case EQUALS:
                return cmp == 0;
            default:
                return false;
        }
    }

    /**
     * Resolve a stored condition code. Accepts "more_than_*" as an alias of "greater_than_*".
     *
     * @param code Stored code, e.g. "less_than_abs"
     * @return Resolved condition, UNKNOWN if the code is not recognized
     */
    public static WhenCondition fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "less_than_abs":
            case "less_than":
                return LESS_THAN_ABS;
            case "less_than_pct":
                return LESS_THAN_PCT;
            case "greater_than_abs":
            case "more_than_abs":
            case "greater_than":
            case "more_than":
                return GREATER_THAN_ABS;
            case "greater_than_pct":
            case "more_than_pct":
                return GREATER_THAN_PCT;
            case "equals":
                return EQUALS;
            default:
                return UNKNOWN;
        }
    }
}
