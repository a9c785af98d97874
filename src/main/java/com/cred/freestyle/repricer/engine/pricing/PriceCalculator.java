package com.cred.freestyle.repricer.engine.pricing;

import com.cred.freestyle.repricer.domain.model.PricingRule;
import com.cred.freestyle.repricer.domain.model.ThenAction;
import com.cred.freestyle.repricer.domain.model.ThenMode;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Price arithmetic for rule actions. Results are never negative and are rounded half-up to cents.
 *
 * <pre>
 *              fixed              percentage
 * increase     current + v        current * (1 + v/100)
 * decrease     current - v        current * (1 - v/100)
 * set          v                  current * (v/100)
 * </pre>
 *
 * @author Repricer Team
 */
public final class PriceCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int SCALE = 2;

    private PriceCalculator() {
    }

    /**
     * Apply a rule's action to a price. An unknown action returns the price unchanged (rounded).
     */
    public static BigDecimal computePrice(BigDecimal current, PricingRule rule) {
        return apply(current, rule.resolveAction(), rule.resolveMode(), rule.thenValueAsDecimal());
    }

    /**
     * Compute the new compare-at price for a rule that changes it.
     *
     * @param currentCompareAt Existing compare-at price, null if the variant has none
     * @param originalPrice Price before this change, used when there is no compare-at price
     * @param rule Rule being applied
     * @return New compare-at price, or null when the rule does not touch compare-at prices
     */
    public static BigDecimal computeCompareAt(BigDecimal currentCompareAt, BigDecimal originalPrice,
                                              PricingRule rule) {
        if (!rule.shouldChangeCompareAt()) {
            return null;
        }
        BigDecimal base = currentCompareAt != null ? currentCompareAt : originalPrice;
        return computePrice(base, rule);
    }

    static BigDecimal apply(BigDecimal current, ThenAction action, ThenMode mode, BigDecimal value) {
        BigDecimal base = current != null ? current : BigDecimal.ZERO;
        BigDecimal result;
        switch (action) {
            case INCREASE:
                result = mode == ThenMode.PERCENTAGE
                        ? base.multiply(BigDecimal.ONE.add(percent(value)))
                        : base.add(value);
                break;
            case DECREASE:
                result = mode == ThenMode.PERCENTAGE
                        ? base.multiply(BigDecimal.ONE.subtract(percent(value)))
                        : base.subtract(value);
                break;
            case SET:
                result = mode == ThenMode.PERCENTAGE
                        ? base.multiply(percent(value))
                        : value;
                break;
            default:
                result = base;
        }
        if (result.signum() < 0) {
            result = BigDecimal.ZERO;
        }
        return result.setScale(SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal percent(BigDecimal value) {
        return value.divide(HUNDRED);
    }
}
