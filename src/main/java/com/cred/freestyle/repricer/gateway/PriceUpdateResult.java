package com.cred.freestyle.repricer.gateway;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a price mutation.
 *
 * @author Repricer Team
 */
public class PriceUpdateResult {

    private final boolean success;
    private final String variantId;
    private final BigDecimal price;
    private final BigDecimal compareAtPrice;
    private final List<String> errors;

    private PriceUpdateResult(boolean success, String variantId, BigDecimal price,
                              BigDecimal compareAtPrice, List<String> errors) {
        this.success = success;
        this.variantId = variantId;
        this.price = price;
        this.compareAtPrice = compareAtPrice;
        this.errors = errors;
    }

    public static PriceUpdateResult success(String variantId, BigDecimal price, BigDecimal compareAtPrice) {
        return new PriceUpdateResult(true, variantId, price, compareAtPrice, Collections.emptyList());
    }

    public static PriceUpdateResult failure(List<String> errors) {
        return new PriceUpdateResult(false, null, null, null, List.copyOf(errors));
    }

    public static PriceUpdateResult failure(String error) {
        return failure(Collections.singletonList(error));
    }

    public boolean isSuccess() {
        return success;
    }

    public String getVariantId() {
        return variantId;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public BigDecimal getCompareAtPrice() {
        return compareAtPrice;
    }

    public List<String> getErrors() {
        return errors;
    }
}
