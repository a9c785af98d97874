package com.cred.freestyle.repricer.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only snapshot of a variant's inventory and price, written only when one of them changed
 * since the previous snapshot.
 *
 * @author Repricer Team
 */
@Entity
@Table(name = "variant_state_history", indexes = {
    @Index(name = "idx_variant_history_variant_time", columnList = "variant_id, captured_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariantStateHistory {

    @Id
    @Column(name = "history_id", nullable = false, length = 36)
    private String historyId;

    @Column(name = "variant_id", nullable = false, length = 255)
    private String variantId;

    @Column(name = "product_id", length = 255)
    private String productId;

    @Column(name = "shop_domain", length = 255)
    private String shopDomain;

    @Column(name = "inventory_quantity", nullable = false)
    private Integer inventoryQuantity;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "compare_at_price", precision = 12, scale = 2)
    private BigDecimal compareAtPrice;

    /**
     * Difference to the previous snapshot; null for the first snapshot of a variant.
     */
    @Column(name = "inventory_change")
    private Integer inventoryChange;

    @Column(name = "price_change", precision = 12, scale = 2)
    private BigDecimal priceChange;

    @Column(name = "change_reason", length = 100)
    private String changeReason;

    @Column(name = "captured_at", nullable = false)
    private Instant capturedAt;

    @PrePersist
    protected void onCreate() {
        if (historyId == null) {
            historyId = UUID.randomUUID().toString();
        }
        if (capturedAt == null) {
            capturedAt = Instant.now();
        }
    }
}
