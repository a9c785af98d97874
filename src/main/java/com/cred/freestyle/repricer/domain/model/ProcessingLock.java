package com.cred.freestyle.repricer.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Store-backed mutual exclusion record.
 *
 * The unique index on {@code lock_key} is what makes acquisition safe across instances: inserting a
 * second row for the same key fails. A row whose {@code expiresAt} has passed is considered free and
 * can be taken over with a conditional update.
 *
 * @author Repricer Team
 */
@Entity
@Table(name = "processing_locks", indexes = {
    @Index(name = "idx_lock_key", columnList = "lock_key", unique = true),
    @Index(name = "idx_lock_expires_at", columnList = "expires_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingLock {

    @Id
    @Column(name = "lock_id", nullable = false, length = 36)
    private String lockId;

    @Column(name = "lock_key", nullable = false, unique = true, length = 255)
    private String lockKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "lock_type", nullable = false, length = 30)
    private LockType lockType;

    /**
     * Identifies the holder: instance id plus a per-acquisition nonce.
     */
    @Column(name = "owner_token", nullable = false, length = 255)
    private String ownerToken;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (lockId == null) {
            lockId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    /**
     * Lock scope.
     */
    public enum LockType {
        /**
         * Per inbound message; stops redelivered events from being processed twice.
         */
        WEBHOOK_PROCESSING,

        /**
         * Per variant; serializes read-modify-write of a variant's price.
         */
        CAMPAIGN_EXECUTION
    }
}
