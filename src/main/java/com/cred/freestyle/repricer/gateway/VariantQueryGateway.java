package com.cred.freestyle.repricer.gateway;

import java.util.Optional;

/**
 * Read access to variants on the commerce platform.
 *
 * @author Repricer Team
 */
public interface VariantQueryGateway {

    /**
     * @param shopDomain Shop the variant belongs to
     * @param variantId Variant global id
     * @return The variant, empty if it does not exist or cannot be read
     */
    Optional<VariantSnapshot> getVariant(String shopDomain, String variantId);

    /**
     * @param shopDomain Shop the inventory item belongs to
     * @param inventoryItemId Numeric or global inventory item id
     * @return The variant owning the inventory item, empty if none
     */
    Optional<VariantSnapshot> getVariantByInventoryItem(String shopDomain, String inventoryItemId);
}
