package com.cred.freestyle.repricer.engine.cooldown;

import com.cred.freestyle.repricer.domain.model.PriceCooldown;
import com.cred.freestyle.repricer.domain.model.PriceCooldown.CooldownType;
import com.cred.freestyle.repricer.repository.PriceCooldownRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Relational cooldown store backed by {@code price_cooldowns} (unique on key + type).
 *
 * @author Repricer Team
 */
@Component
@ConditionalOnProperty(name = "repricer.store.backend", havingValue = "jpa", matchIfMissing = true)
public class JpaCooldownStore implements CooldownStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaCooldownStore.class);

    private final PriceCooldownRepository cooldownRepository;

    public JpaCooldownStore(PriceCooldownRepository cooldownRepository) {
        this.cooldownRepository = cooldownRepository;
    }

    @Override
    public boolean isActive(String cooldownKey, CooldownType cooldownType, Instant now) {
        return cooldownRepository.existsByCooldownKeyAndCooldownTypeAndExpiresAtAfter(cooldownKey, cooldownType, now);
    }

    @Override
    public void upsert(String cooldownKey, CooldownType cooldownType, String campaignId,
                       Instant expiresAt, Instant now) {
        if (cooldownRepository.updateExpiry(cooldownKey, cooldownType, campaignId, expiresAt, now) > 0) {
            return;
        }

        PriceCooldown cooldown = PriceCooldown.builder()
                .cooldownKey(cooldownKey)
                .cooldownType(cooldownType)
                .campaignId(campaignId)
                .expiresAt(expiresAt)
                .createdAt(now)
                .build();
        try {
            cooldownRepository.saveAndFlush(cooldown);
        } catch (DataIntegrityViolationException e) {
            // Inserted concurrently by another instance; move its expiry instead
            logger.debug("Concurrent cooldown insert for {} ({}), updating instead", cooldownKey, cooldownType);
            cooldownRepository.updateExpiry(cooldownKey, cooldownType, campaignId, expiresAt, now);
        }
    }

    @Override
    public boolean delete(String cooldownKey, CooldownType cooldownType) {
        return cooldownRepository.deleteByKeyAndType(cooldownKey, cooldownType) > 0;
    }

    @Override
    public int deleteExpired(Instant now) {
        return cooldownRepository.deleteExpired(now);
    }

    @Override
    public List<PriceCooldown> findActive(Instant now) {
        return cooldownRepository.findActive(now);
    }
}
