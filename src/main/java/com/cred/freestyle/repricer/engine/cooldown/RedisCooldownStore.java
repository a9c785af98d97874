package com.cred.freestyle.repricer.engine.cooldown;

import com.cred.freestyle.repricer.domain.model.PriceCooldown;
import com.cred.freestyle.repricer.domain.model.PriceCooldown.CooldownType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Redis cooldown store. Each cooldown is a string key with a native TTL:
 * {@code repricer:cooldown:{TYPE}:{key}} holding the campaign id (empty when none).
 *
 * @author Repricer Team
 */
@Component
@ConditionalOnProperty(name = "repricer.store.backend", havingValue = "redis")
public class RedisCooldownStore implements CooldownStore {

    static final String KEY_PREFIX = "repricer:cooldown:";

    private final StringRedisTemplate stringRedisTemplate;

    public RedisCooldownStore(StringRedisTemplate stringRedisTemplate) {
        this.stringRedisTemplate = stringRedisTemplate;
    }

    @Override
    public boolean isActive(String cooldownKey, CooldownType cooldownType, Instant now) {
        return Boolean.TRUE.equals(stringRedisTemplate.hasKey(redisKey(cooldownKey, cooldownType)));
    }

    @Override
    public void upsert(String cooldownKey, CooldownType cooldownType, String campaignId,
                       Instant expiresAt, Instant now) {
        Duration ttl = Duration.between(now, expiresAt);
        if (ttl.isZero() || ttl.isNegative()) {
            delete(cooldownKey, cooldownType);
            return;
        }
        stringRedisTemplate.opsForValue().set(
                redisKey(cooldownKey, cooldownType),
                campaignId != null ? campaignId : "",
                ttl
        );
    }

    @Override
    public boolean delete(String cooldownKey, CooldownType cooldownType) {
        return Boolean.TRUE.equals(stringRedisTemplate.delete(redisKey(cooldownKey, cooldownType)));
    }

    @Override
    public int deleteExpired(Instant now) {
        // Redis evicts expired keys itself
        return 0;
    }

    @Override
    public List<PriceCooldown> findActive(Instant now) {
        Set<String> keys = stringRedisTemplate.keys(KEY_PREFIX + "*");
        List<PriceCooldown> cooldowns = new ArrayList<>();
        if (keys == null) {
            return cooldowns;
        }
        for (String key : keys) {
            Long ttlMillis = stringRedisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
            if (ttlMillis == null || ttlMillis <= 0) {
                continue;
            }
            String rest = key.substring(KEY_PREFIX.length());
            int separator = rest.indexOf(':');
            if (separator < 0) {
                continue;
            }
            CooldownType type;
            try {
                type = CooldownType.valueOf(rest.substring(0, separator));
            } catch (IllegalArgumentException e) {
                continue;
            }
            String campaignId = stringRedisTemplate.opsForValue().get(key);
            cooldowns.add(PriceCooldown.builder()
                    .cooldownKey(rest.substring(separator + 1))
                    .cooldownType(type)
                    .campaignId(campaignId == null || campaignId.isEmpty() ? null : campaignId)
                    .expiresAt(now.plusMillis(ttlMillis))
                    .build());
        }
        cooldowns.sort(Comparator.comparing(PriceCooldown::getExpiresAt));
        return cooldowns;
    }

    static String redisKey(String cooldownKey, CooldownType cooldownType) {
        return KEY_PREFIX + cooldownType.name() + ":" + cooldownKey;
    }
}
