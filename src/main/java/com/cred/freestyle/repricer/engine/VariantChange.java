package com.cred.freestyle.repricer.engine;

import com.cred.freestyle.repricer.gateway.VariantSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The variant an event is about, as extracted from its payload.
 *
 * @author Repricer Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariantChange {

    private String variantId;

    private String productId;

    private String inventoryItemId;

    /**
     * Inventory quantity stated by the webhook itself; null when the payload carries none.
     */
    private Integer reportedInventory;

    /**
     * Variant already read from the platform during extraction, if any.
     */
    private VariantSnapshot prefetched;
}
