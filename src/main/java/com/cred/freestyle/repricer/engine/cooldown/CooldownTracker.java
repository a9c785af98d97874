package com.cred.freestyle.repricer.engine.cooldown;

import com.cred.freestyle.repricer.config.EngineProperties;
import com.cred.freestyle.repricer.domain.model.PriceCooldown;
import com.cred.freestyle.repricer.domain.model.PriceCooldown.CooldownType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Time-boxed suppression of variants and campaigns.
 *
 * Two cooldown kinds exist:
 * - PRICE_UPDATE keyed by variant id: no automated price change on the variant while active.
 *   It is set before a mutation is attempted so that the engine's own write, echoed back as a new
 *   webhook, finds it already in place.
 * - CAMPAIGN_TRIGGER keyed by "campaign_{id}": the campaign is skipped while active.
 *
 * Expiry is lazy: an expired record counts as absent whether or not it has been deleted yet.
 *
 * @author Repricer Team
 */
@Service
public class CooldownTracker {

    private static final Logger logger = LoggerFactory.getLogger(CooldownTracker.class);

    static final String CAMPAIGN_KEY_PREFIX = "campaign_";

    private final CooldownStore cooldownStore;
    private final Clock clock;
    private final Duration variantCooldownTtl;
    private final Duration campaignCooldownTtl;

    public CooldownTracker(CooldownStore cooldownStore, Clock clock, EngineProperties engineProperties) {
        this.cooldownStore = cooldownStore;
        this.clock = clock;
        this.variantCooldownTtl = engineProperties.getVariantCooldownTtl();
        this.campaignCooldownTtl = engineProperties.getCampaignCooldownTtl();
    }

    /**
     * Check whether a key is currently suppressed. A store failure is logged and reported as
     * "not suppressed"; the variant lock still serializes the work.
     */
    public boolean isSuppressed(String key, CooldownType type) {
        try {
            return cooldownStore.isActive(key, type, clock.instant());
        } catch (Exception e) {
            logger.error("Cooldown store unavailable while checking {} ({}), assuming none", key, type, e);
            return false;
        }
    }

    /**
     * Set or extend a cooldown.
     *
     * @return Expiry of the cooldown
     */
    public Instant set(String key, CooldownType type, Duration ttl, String campaignId) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        cooldownStore.upsert(key, type, campaignId, expiresAt, now);
        logger.debug("Cooldown set: {} ({}) until {}", key, type, expiresAt);
        return expiresAt;
    }

    /**
     * Remove a cooldown.
     *
     * @return true if a record was removed
     */
    public boolean clear(String key, CooldownType type) {
        boolean removed = cooldownStore.delete(key, type);
        logger.debug("Cooldown cleared: {} ({}), removed: {}", key, type, removed);
        return removed;
    }

    public boolean isVariantCoolingDown(String variantId) {
        return isSuppressed(variantId, CooldownType.PRICE_UPDATE);
    }

    public Instant setVariantCooldown(String variantId, String campaignId) {
        return set(variantId, CooldownType.PRICE_UPDATE, variantCooldownTtl, campaignId);
    }

    public boolean clearVariantCooldown(String variantId) {
        return clear(variantId, CooldownType.PRICE_UPDATE);
    }

    public boolean isCampaignCoolingDown(String campaignId) {
        return isSuppressed(campaignKey(campaignId), CooldownType.CAMPAIGN_TRIGGER);
    }

    public Instant setCampaignCooldown(String campaignId) {
        return set(campaignKey(campaignId), CooldownType.CAMPAIGN_TRIGGER, campaignCooldownTtl, campaignId);
    }

    /**
     * @return Active cooldowns, soonest expiry first
     */
    public List<PriceCooldown> listActive() {
        return cooldownStore.findActive(clock.instant());
    }

    /**
     * Delete expired cooldown records.
     *
     * @return Number of records deleted
     */
    public int purgeExpired() {
        int deleted = cooldownStore.deleteExpired(clock.instant());
        if (deleted > 0) {
            logger.info("Purged {} expired cooldowns", deleted);
        }
        return deleted;
    }

    public static String campaignKey(String campaignId) {
        return CAMPAIGN_KEY_PREFIX + campaignId;
    }
}
