package com.cred.freestyle.repricer.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Campaign entity: a named, prioritized set of pricing rules scoped to a shop and a product target.
 *
 * Only ACTIVE campaigns are evaluated by the engine. The engine never edits a campaign's definition;
 * it only bumps {@code triggerCount} and {@code lastTriggeredAt} after a successful price change.
 *
 * @author Repricer Team
 */
@Entity
@Table(name = "campaigns", indexes = {
    @Index(name = "idx_campaign_shop_status", columnList = "shop_domain, status"),
    @Index(name = "idx_campaign_priority", columnList = "priority")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Campaign {

    @Id
    @Column(name = "campaign_id", nullable = false, length = 36)
    private String campaignId;

    /**
     * Tenant the campaign belongs to (e.g. "acme.myshopify.com").
     */
    @Column(name = "shop_domain", nullable = false, length = 255)
    private String shopDomain;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "description", length = 1000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CampaignStatus status;

    /**
     * Evaluation order across campaigns; lower values run first.
     */
    @Column(name = "priority", nullable = false)
    @Builder.Default
    private Integer priority = 100;

    @Embedded
    @Builder.Default
    private TargetCriteria targetCriteria = new TargetCriteria();

    @OneToMany(mappedBy = "campaign", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<PricingRule> rules = new ArrayList<>();

    @Column(name = "trigger_count", nullable = false)
    @Builder.Default
    private Integer triggerCount = 0;

    @Column(name = "last_triggered_at")
    private Instant lastTriggeredAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (campaignId == null) {
            campaignId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (status == null) {
            status = CampaignStatus.DRAFT;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Attach a rule to this campaign, keeping both sides of the association in sync.
     *
     * @param rule Rule to add
     */
    public void addRule(PricingRule rule) {
        rule.setCampaign(this);
        if (rule.getPosition() == null) {
            rule.setPosition(rules.size());
        }
        rules.add(rule);
    }

    public boolean isActive() {
        return status == CampaignStatus.ACTIVE;
    }

    /**
     * Campaign lifecycle status.
     */
    public enum CampaignStatus {
        DRAFT,
        /**
         * Evaluated against inbound inventory events.
         */
        ACTIVE,
        PAUSED,
        COMPLETED,
        ARCHIVED
    }
}
