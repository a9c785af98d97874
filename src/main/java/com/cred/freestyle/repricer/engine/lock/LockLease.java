package com.cred.freestyle.repricer.engine.lock;

import com.cred.freestyle.repricer.domain.model.ProcessingLock.LockType;

import java.time.Instant;

/**
 * A held processing lock. Closing the lease releases the lock if it is still owned;
 * closing twice is harmless.
 *
 * <pre>
 * try (LockLease lease = lockManager.tryAcquire(key, type, ttl).orElse(null)) {
 *     if (lease == null) { return; }
 *     // critical section
 * }
 * </pre>
 *
 * @author Repricer Team
 */
public class LockLease implements AutoCloseable {

    private final LockManager lockManager;
    private final String lockKey;
    private final LockType lockType;
    private final String ownerToken;
    private final Instant expiresAt;
    private boolean released;

    LockLease(LockManager lockManager, String lockKey, LockType lockType, String ownerToken, Instant expiresAt) {
        this.lockManager = lockManager;
        this.lockKey = lockKey;
        this.lockType = lockType;
        this.ownerToken = ownerToken;
        this.expiresAt = expiresAt;
    }

    public String getLockKey() {
        return lockKey;
    }

    public LockType getLockType() {
        return lockType;
    }

    public String getOwnerToken() {
        return ownerToken;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        lockManager.release(this);
    }
}
