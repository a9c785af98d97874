package com.cred.freestyle.repricer.domain.model;

import java.util.Locale;

/**
 * Price actions a rule can apply.
 *
 * @author Repricer Team
 */
public enum ThenAction {

    INCREASE,
    DECREASE,
    SET,
    /**
     * Unrecognized action code; the price is left unchanged.
     */
    UNKNOWN;

    /**
     * Resolve a stored action code. Both the editor codes ("increase_price", "reduce_price",
     * "change_price") and the short forms ("increase", "decrease", "set") are accepted.
     */
    public static ThenAction fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "increase_price":
            case "increase":
                return INCREASE;
            case "reduce_price":
            case "decrease_price":
            case "decrease":
                return DECREASE;
            case "change_price":
            case "set_price":
            case "set":
                return SET;
            default:
                return UNKNOWN;
        }
    }
}
