package com.cred.freestyle.repricer.engine.lock;

import com.cred.freestyle.repricer.domain.model.ProcessingLock.LockType;

import java.time.Instant;

/**
 * Shared store holding processing locks.
 *
 * Implementations must make {@link #insertIfAbsent} and {@link #reclaimIfExpired} atomic across
 * processes; in-memory state of a single instance is not enough. Any method may throw a runtime
 * exception when the backing store is unreachable.
 *
 * @author Repricer Team
 */
public interface LockStore {

    /**
     * Create the lock if no record exists for the key.
     *
     * @return true if this call created the lock, false if a record already exists
     */
    boolean insertIfAbsent(String lockKey, LockType lockType, String ownerToken, Instant expiresAt, Instant now);

    /**
     * Take over an existing record whose expiry has passed.
     *
     * @return true if this call took the lock over, false if it is held or another process won
     */
    boolean reclaimIfExpired(String lockKey, LockType lockType, String ownerToken, Instant expiresAt, Instant now);

    /**
     * Delete the lock if it is still owned by the given token.
     *
     * @return true if a record was deleted
     */
    boolean release(String lockKey, String ownerToken);

    /**
     * Delete every expired record.
     *
     * @return Number of records deleted
     */
    int deleteExpired(Instant now);
}
