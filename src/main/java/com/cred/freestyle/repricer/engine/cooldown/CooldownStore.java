package com.cred.freestyle.repricer.engine.cooldown;

import com.cred.freestyle.repricer.domain.model.PriceCooldown;
import com.cred.freestyle.repricer.domain.model.PriceCooldown.CooldownType;

import java.time.Instant;
import java.util.List;

/**
 * Shared store holding cooldown records, keyed by (key, type).
 *
 * @author Repricer Team
 */
public interface CooldownStore {

    /**
     * @return true if a record exists for (key, type) with {@code expiresAt > now}
     */
    boolean isActive(String cooldownKey, CooldownType cooldownType, Instant now);

    /**
     * Create the record or move its expiry, whichever applies.
     */
    void upsert(String cooldownKey, CooldownType cooldownType, String campaignId, Instant expiresAt, Instant now);

    /**
     * @return true if a record was deleted
     */
    boolean delete(String cooldownKey, CooldownType cooldownType);

    /**
     * @return Number of expired records deleted
     */
    int deleteExpired(Instant now);

    /**
     * @return Non-expired records, soonest expiry first
     */
    List<PriceCooldown> findActive(Instant now);
}
