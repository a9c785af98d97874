package com.cred.freestyle.repricer.repository;

import com.cred.freestyle.repricer.domain.model.ProcessingLock;
import com.cred.freestyle.repricer.domain.model.ProcessingLock.LockType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Repository interface for ProcessingLock entity.
 *
 * Every mutating query is conditional so that two instances racing on the same key cannot both win:
 * the database decides, and the loser sees an update count of 0.
 *
 * @author Repricer Team
 */
@Repository
public interface ProcessingLockRepository extends JpaRepository<ProcessingLock, String> {

    /**
     * Take over an expired lock. Only succeeds while the stored row is still expired.
     *
     * @return 1 if the lock was taken over, 0 if it is held (or was reclaimed first by someone else)
     */
    @Modifying
    @Transactional
    @Query("UPDATE ProcessingLock l SET l.ownerToken = :ownerToken, l.lockType = :lockType, " +
           "l.expiresAt = :expiresAt, l.createdAt = :now " +
           "WHERE l.lockKey = :lockKey AND l.expiresAt <= :now")
    int reclaimExpired(
            @Param("lockKey") String lockKey,
            @Param("lockType") LockType lockType,
            @Param("ownerToken") String ownerToken,
            @Param("expiresAt") Instant expiresAt,
            @Param("now") Instant now
    );

    /**
     * Release a lock, but only if it is still owned by the given token.
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM ProcessingLock l WHERE l.lockKey = :lockKey AND l.ownerToken = :ownerToken")
    int deleteOwned(@Param("lockKey") String lockKey, @Param("ownerToken") String ownerToken);

    @Modifying
    @Transactional
    @Query("DELETE FROM ProcessingLock l WHERE l.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
