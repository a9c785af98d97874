package com.cred.freestyle.repricer.engine.lock;

import com.cred.freestyle.repricer.config.EngineProperties;
import com.cred.freestyle.repricer.domain.model.ProcessingLock.LockType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * TTL-bounded mutual exclusion over named keys, shared by every processing instance.
 *
 * Acquisition protocol:
 * 1. Insert the lock record; the store rejects a second record for the same key.
 * 2. If a record exists, try to take it over with a conditional update that only matches
 *    an expired record.
 * 3. Losing both steps means another process holds the key.
 *
 * There is no waiting and no retry: a held key is a terminal outcome for the caller. Store failures
 * are treated as "not acquired" so that nothing is ever processed without a lock.
 *
 * @author Repricer Team
 */
@Service
public class LockManager {

    private static final Logger logger = LoggerFactory.getLogger(LockManager.class);

    private final LockStore lockStore;
    private final Clock clock;
    private final String instanceId;

    public LockManager(LockStore lockStore, Clock clock, EngineProperties engineProperties) {
        this.lockStore = lockStore;
        this.clock = clock;
        this.instanceId = engineProperties.getInstanceId();
    }

    /**
     * Attempt to acquire a lock.
     *
     * @param lockKey Lock key, e.g. "webhook_{messageId}" or "variant_processing_{variantId}"
     * @param lockType Lock scope
     * @param ttl Time after which the lock may be reclaimed by another process
     * @return The lease if acquired, empty if held elsewhere or the store failed
     */
    public Optional<LockLease> tryAcquire(String lockKey, LockType lockType, Duration ttl) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        String ownerToken = instanceId + ":" + UUID.randomUUID();

        try {
            if (lockStore.insertIfAbsent(lockKey, lockType, ownerToken, expiresAt, now)) {
                logger.debug("Acquired lock: {} ({}) until {}", lockKey, lockType, expiresAt);
                return Optional.of(new LockLease(this, lockKey, lockType, ownerToken, expiresAt));
            }

            if (lockStore.reclaimIfExpired(lockKey, lockType, ownerToken, expiresAt, now)) {
                logger.info("Reclaimed expired lock: {} ({})", lockKey, lockType);
                return Optional.of(new LockLease(this, lockKey, lockType, ownerToken, expiresAt));
            }

            logger.debug("Lock held by another process: {}", lockKey);
            return Optional.empty();
        } catch (Exception e) {
            logger.error("Lock store unavailable while acquiring {}, treating as not acquired", lockKey, e);
            return Optional.empty();
        }
    }

    /**
     * Release a lease. Failures are logged; the TTL bounds how long a lock can outlive its holder.
     *
     * @param lease Lease to release
     * @return true if the lock record was deleted
     */
    public boolean release(LockLease lease) {
        try {
            boolean released = lockStore.release(lease.getLockKey(), lease.getOwnerToken());
            if (released) {
                logger.debug("Released lock: {} ({})", lease.getLockKey(), lease.getLockType());
            } else {
                logger.warn("Lock {} ({}) was no longer owned at release (expired and reclaimed?)",
                        lease.getLockKey(), lease.getLockType());
            }
            return released;
        } catch (Exception e) {
            logger.error("Error releasing lock {}, it will expire at {}", lease.getLockKey(), lease.getExpiresAt(), e);
            return false;
        }
    }

    /**
     * Delete expired lock records.
     *
     * @return Number of records deleted
     */
    public int purgeExpired() {
        int deleted = lockStore.deleteExpired(clock.instant());
        if (deleted > 0) {
            logger.info("Purged {} expired processing locks", deleted);
        }
        return deleted;
    }
}
