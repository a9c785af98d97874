package com.cred.freestyle.repricer.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit record of a price or compare-at change. Rows are never updated.
 *
 * @author Repricer Team
 */
@Entity
@Table(name = "audit_trail_entries", indexes = {
    @Index(name = "idx_audit_entity", columnList = "entity_type, entity_id"),
    @Index(name = "idx_audit_campaign", columnList = "campaign_id"),
    @Index(name = "idx_audit_shop_time", columnList = "shop_domain, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditTrailEntry {

    public static final String ENTITY_VARIANT = "variant";
    public static final String CHANGE_PRICE = "price_update";
    public static final String CHANGE_COMPARE_AT = "compare_at_update";

    @Id
    @Column(name = "entry_id", nullable = false, length = 36)
    private String entryId;

    @Column(name = "entity_type", nullable = false, length = 30)
    private String entityType;

    @Column(name = "entity_id", nullable = false, length = 255)
    private String entityId;

    @Column(name = "product_id", length = 255)
    private String productId;

    @Column(name = "change_type", nullable = false, length = 30)
    private String changeType;

    @Column(name = "old_value", length = 50)
    private String oldValue;

    @Column(name = "new_value", length = 50)
    private String newValue;

    @Column(name = "trigger_reason", length = 1000)
    private String triggerReason;

    @Column(name = "campaign_id", length = 36)
    private String campaignId;

    @Column(name = "rule_id", length = 36)
    private String ruleId;

    @Column(name = "source_message_id", length = 255)
    private String sourceMessageId;

    @Column(name = "shop_domain", nullable = false, length = 255)
    private String shopDomain;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (entryId == null) {
            entryId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
