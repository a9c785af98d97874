package com.cred.freestyle.repricer.engine.lock;

import com.cred.freestyle.repricer.domain.model.ProcessingLock;
import com.cred.freestyle.repricer.domain.model.ProcessingLock.LockType;
import com.cred.freestyle.repricer.repository.ProcessingLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Relational lock store. The unique index on {@code processing_locks.lock_key} provides
 * create-or-fail semantics; expired locks are taken over with a conditional update.
 *
 * @author Repricer Team
 */
@Component
@ConditionalOnProperty(name = "repricer.store.backend", havingValue = "jpa", matchIfMissing = true)
public class JpaLockStore implements LockStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaLockStore.class);

    private final ProcessingLockRepository lockRepository;

    public JpaLockStore(ProcessingLockRepository lockRepository) {
        this.lockRepository = lockRepository;
    }

    @Override
    public boolean insertIfAbsent(String lockKey, LockType lockType, String ownerToken,
                                  Instant expiresAt, Instant now) {
        ProcessingLock lock = ProcessingLock.builder()
                .lockKey(lockKey)
                .lockType(lockType)
                .ownerToken(ownerToken)
                .expiresAt(expiresAt)
                .createdAt(now)
                .build();
        try {
            lockRepository.saveAndFlush(lock);
            return true;
        } catch (DataIntegrityViolationException e) {
            // Unique constraint on lock_key: somebody holds (or held) this key
            logger.debug("Lock row already exists for key: {}", lockKey);
            return false;
        }
    }

    @Override
    public boolean reclaimIfExpired(String lockKey, LockType lockType, String ownerToken,
                                    Instant expiresAt, Instant now) {
        return lockRepository.reclaimExpired(lockKey, lockType, ownerToken, expiresAt, now) == 1;
    }

    @Override
    public boolean release(String lockKey, String ownerToken) {
        return lockRepository.deleteOwned(lockKey, ownerToken) > 0;
    }

    @Override
    public int deleteExpired(Instant now) {
        return lockRepository.deleteExpired(now);
    }
}
