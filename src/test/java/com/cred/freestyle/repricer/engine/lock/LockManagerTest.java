package com.cred.freestyle.repricer.engine.lock;

import com.cred.freestyle.repricer.config.EngineProperties;
import com.cred.freestyle.repricer.domain.model.ProcessingLock.LockType;
import com.cred.freestyle.repricer.testutil.InMemoryLockStore;
import com.cred.freestyle.repricer.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for LockManager over an in-memory store.
 */
@DisplayName("LockManager Tests")
class LockManagerTest {

    private static final Duration TTL = Duration.ofSeconds(60);

    private InMemoryLockStore lockStore;
    private MutableClock clock;
    private LockManager lockManager;

    @BeforeEach
    void setUp() {
        lockStore = new InMemoryLockStore();
        clock = MutableClock.at("2024-01-01T12:00:00Z");
        EngineProperties properties = EngineProperties.builder().instanceId("node-a").build();
        lockManager = new LockManager(lockStore, clock, properties);
    }

    @Test
    @DisplayName("tryAcquire - Free key is acquired with an instance-scoped owner token")
    void tryAcquire_FreeKey_Acquired() {
        // When
        Optional<LockLease> lease = lockManager.tryAcquire("webhook_m1", LockType.WEBHOOK_PROCESSING, TTL);

        // Then
        assertThat(lease).isPresent();
        assertThat(lease.get().getLockType()).isEqualTo(LockType.WEBHOOK_PROCESSING);
        assertThat(lease.get().getOwnerToken()).startsWith("node-a:");
        assertThat(lease.get().getExpiresAt()).isEqualTo(clock.instant().plus(TTL));
        assertThat(lockStore.isHeld("webhook_m1")).isTrue();
    }

    @Test
    @DisplayName("tryAcquire - Held key is not acquired")
    void tryAcquire_HeldKey_NotAcquired() {
        // Given
        lockManager.tryAcquire("webhook_m1", LockType.WEBHOOK_PROCESSING, TTL);

        // When
        Optional<LockLease> second = lockManager.tryAcquire("webhook_m1", LockType.WEBHOOK_PROCESSING, TTL);

        // Then
        assertThat(second).isEmpty();
    }

    @Test
    @DisplayName("tryAcquire - Expired lock is reclaimed and the previous owner can no longer release it")
    void tryAcquire_ExpiredLock_Reclaimed() {
        // Given
        LockLease stale = lockManager.tryAcquire("variant_processing_1", LockType.CAMPAIGN_EXECUTION, TTL).orElseThrow();
        clock.advance(TTL.plusSeconds(1));

        // When
        Optional<LockLease> fresh = lockManager.tryAcquire("variant_processing_1", LockType.CAMPAIGN_EXECUTION, TTL);

        // Then
        assertThat(fresh).isPresent();
        assertThat(fresh.get().getOwnerToken()).isNotEqualTo(stale.getOwnerToken());
        assertThat(lockManager.release(stale)).isFalse();
        assertThat(lockStore.isHeld("variant_processing_1")).isTrue();
    }

    @Test
    @DisplayName("tryAcquire - Lock exactly at its expiry instant is reclaimable")
    void tryAcquire_AtExpiryInstant_Reclaimed() {
        // Given
        lockManager.tryAcquire("k", LockType.CAMPAIGN_EXECUTION, TTL);
        clock.advance(TTL);

        // When / Then
        assertThat(lockManager.tryAcquire("k", LockType.CAMPAIGN_EXECUTION, TTL)).isPresent();
    }

    @Test
    @DisplayName("tryAcquire - Store failure is reported as not acquired")
    void tryAcquire_StoreFailure_NotAcquired() {
        // Given
        lockStore.setFailing(true);

        // When / Then
        assertThat(lockManager.tryAcquire("k", LockType.WEBHOOK_PROCESSING, TTL)).isEmpty();
    }

    @Test
    @DisplayName("close - Releases once, second close is a no-op")
    void close_Idempotent() {
        // Given
        LockLease lease = lockManager.tryAcquire("k", LockType.WEBHOOK_PROCESSING, TTL).orElseThrow();

        // When
        lease.close();
        lockManager.tryAcquire("k", LockType.WEBHOOK_PROCESSING, TTL).orElseThrow();
        lease.close();

        // Then
        assertThat(lease.isReleased()).isTrue();
        assertThat(lockStore.isHeld("k")).isTrue();
    }

    @Test
    @DisplayName("release - Store failure returns false without throwing")
    void release_StoreFailure_False() {
        // Given
        LockLease lease = lockManager.tryAcquire("k", LockType.WEBHOOK_PROCESSING, TTL).orElseThrow();
        lockStore.setFailing(true);

        // When / Then
        assertThat(lockManager.release(lease)).isFalse();
    }

    @Test
    @DisplayName("purgeExpired - Deletes only expired locks")
    void purgeExpired_DeletesExpiredOnly() {
        // Given
        lockManager.tryAcquire("short", LockType.WEBHOOK_PROCESSING, Duration.ofSeconds(10));
        lockManager.tryAcquire("long", LockType.WEBHOOK_PROCESSING, Duration.ofSeconds(600));
        clock.advance(Duration.ofSeconds(30));

        // When
        int purged = lockManager.purgeExpired();

        // Then
        assertThat(purged).isEqualTo(1);
        assertThat(lockStore.isHeld("short")).isFalse();
        assertThat(lockStore.isHeld("long")).isTrue();
    }

    @Test
    @DisplayName("Concurrency - Exactly one of many contenders acquires the key")
    void tryAcquire_Concurrent_SingleWinner() throws Exception {
        // Given
        int contenders = 16;
        ExecutorService executor = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();

        // When
        for (int i = 0; i < contenders; i++) {
            executor.submit(() -> {
                start.await();
                if (lockManager.tryAcquire("variant_processing_1", LockType.CAMPAIGN_EXECUTION, TTL).isPresent()) {
                    winners.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        // Then
        assertThat(winners.get()).isEqualTo(1);
    }
}
