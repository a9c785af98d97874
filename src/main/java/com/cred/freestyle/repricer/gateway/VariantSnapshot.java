package com.cred.freestyle.repricer.gateway;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * A variant as observed on the commerce platform at evaluation time, together with the product
 * metadata used for campaign targeting.
 *
 * @author Repricer Team
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VariantSnapshot {

    /**
     * Variant global id, e.g. "gid://shopify/ProductVariant/123".
     */
    private String variantId;

    /**
     * Product global id, e.g. "gid://shopify/Product/456".
     */
    private String productId;

    private String inventoryItemId;

    private BigDecimal price;

    private BigDecimal compareAtPrice;

    private int inventoryQuantity;

    /**
     * False when the platform does not track inventory for this variant; such variants are never evaluated.
     */
    private boolean inventoryTracked;

    private String vendor;

    private String productType;

    @Builder.Default
    private Set<String> tags = new HashSet<>();

    @Builder.Default
    private Set<String> collectionIds = new HashSet<>();

    private Instant capturedAt;

    /**
     * Same variant with a different inventory quantity (the webhook's value is fresher than the query).
     */
    public VariantSnapshot withInventoryQuantity(int quantity) {
        return toBuilder().inventoryQuantity(quantity).build();
    }
}
