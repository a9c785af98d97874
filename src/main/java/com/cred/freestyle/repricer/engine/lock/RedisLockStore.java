package com.cred.freestyle.repricer.engine.lock;

import com.cred.freestyle.repricer.domain.model.ProcessingLock.LockType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;

/**
 * Redis lock store using the SET NX PX pattern.
 *
 * Redis expires keys natively, so an expired lock is simply absent and {@link #insertIfAbsent}
 * succeeds; there is nothing to reclaim and nothing to purge. Release runs a Lua script so the owner
 * check and the delete are atomic.
 *
 * @author Repricer Team
 */
@Component
@ConditionalOnProperty(name = "repricer.store.backend", havingValue = "redis")
public class RedisLockStore implements LockStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisLockStore.class);

    static final String KEY_PREFIX = "repricer:lock:";

    static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate stringRedisTemplate;

    public RedisLockStore(StringRedisTemplate stringRedisTemplate) {
        this.stringRedisTemplate = stringRedisTemplate;
    }

    @Override
    public boolean insertIfAbsent(String lockKey, LockType lockType, String ownerToken,
                                  Instant expiresAt, Instant now) {
        Duration ttl = Duration.between(now, expiresAt);
        if (ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        Boolean acquired = stringRedisTemplate.opsForValue()
                .setIfAbsent(KEY_PREFIX + lockKey, ownerToken, ttl);
        return Boolean.TRUE.equals(acquired);
    }

    @Override
    public boolean reclaimIfExpired(String lockKey, LockType lockType, String ownerToken,
                                    Instant expiresAt, Instant now) {
        return false;
    }

    @Override
    public boolean release(String lockKey, String ownerToken) {
        if (ownerToken == null) {
            return false;
        }
        // Owner check and delete run as one script
        Long deleted = stringRedisTemplate.execute(RELEASE_SCRIPT,
                Collections.singletonList(KEY_PREFIX + lockKey), ownerToken);
        if (deleted == null || deleted == 0L) {
            logger.warn("Lock token mismatch for key: {} (expected: {})", lockKey, ownerToken);
            return false;
        }
        return true;
    }

    @Override
    public int deleteExpired(Instant now) {
        return 0;
    }
}
