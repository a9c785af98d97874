package com.cred.freestyle.repricer.gateway;

import java.math.BigDecimal;

/**
 * Write access to variant prices on the commerce platform. Not transactional: a successful call has
 * already changed the live price.
 *
 * @author Repricer Team
 */
public interface PriceUpdateGateway {

    /**
     * Change a variant's price and, optionally, its compare-at price.
     *
     * @param shopDomain Shop the variant belongs to
     * @param productId Product global id
     * @param variantId Variant global id
     * @param newPrice New price
     * @param newCompareAt New compare-at price, null to leave it unchanged
     * @return Result; user errors reported by the platform yield an unsuccessful result, not an exception
     */
    PriceUpdateResult updateVariantPrice(
            String shopDomain,
            String productId,
            String variantId,
            BigDecimal newPrice,
            BigDecimal newCompareAt
    );
}
