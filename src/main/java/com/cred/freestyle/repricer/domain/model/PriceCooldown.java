package com.cred.freestyle.repricer.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Time-boxed suppression record. While {@code now < expiresAt} the key is suppressed for its type.
 * Expired rows are ignored on read and removed by the periodic cleanup.
 *
 * @author Repricer Team
 */
@Entity
@Table(name = "price_cooldowns",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_cooldown_key_type", columnNames = {"cooldown_key", "cooldown_type"})
    },
    indexes = {
        @Index(name = "idx_cooldown_expires_at", columnList = "expires_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceCooldown {

    @Id
    @Column(name = "cooldown_id", nullable = false, length = 36)
    private String cooldownId;

    /**
     * Variant global id for PRICE_UPDATE, "campaign_{campaignId}" for CAMPAIGN_TRIGGER.
     */
    @Column(name = "cooldown_key", nullable = false, length = 255)
    private String cooldownKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "cooldown_type", nullable = false, length = 30)
    private CooldownType cooldownType;

    @Column(name = "campaign_id", length = 36)
    private String campaignId;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (cooldownId == null) {
            cooldownId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public enum CooldownType {
        PRICE_UPDATE,
        CAMPAIGN_TRIGGER
    }
}
