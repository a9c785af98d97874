package com.cred.freestyle.repricer.repository;

import com.cred.freestyle.repricer.domain.model.ProcessingLock;
import com.cred.freestyle.repricer.domain.model.ProcessingLock.LockType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for ProcessingLockRepository using Testcontainers.
 * The conditional queries are what keep two instances from both holding a lock.
 */
@DataJpaTest
@Testcontainers
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("ProcessingLockRepository Integration Tests")
class ProcessingLockRepositoryIT {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("repricer_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private ProcessingLockRepository lockRepository;

    @Autowired
    private TestEntityManager entityManager;

    private final Instant now = Instant.parse("2024-01-01T12:00:00Z");

    @BeforeEach
    void setUp() {
        lockRepository.deleteAll();
    }

    private ProcessingLock lock(String key, String owner, Instant expiresAt) {
        return lockRepository.saveAndFlush(ProcessingLock.builder()
                .lockKey(key)
                .lockType(LockType.CAMPAIGN_EXECUTION)
                .ownerToken(owner)
                .expiresAt(expiresAt)
                .createdAt(now.minus(1, ChronoUnit.MINUTES))
                .build());
    }

    private Optional<ProcessingLock> stored(String key) {
        return lockRepository.findAll().stream()
                .filter(lock -> lock.getLockKey().equals(key))
                .findFirst();
    }

    @Test
    @DisplayName("reclaimExpired - Should take over an expired lock")
    void reclaimExpired_ExpiredLock_TakesOver() {
        // Given
        lock("variant_processing_gid://shopify/ProductVariant/1", "node-a:1", now.minusSeconds(1));

        // When
        int updated = lockRepository.reclaimExpired("variant_processing_gid://shopify/ProductVariant/1",
                LockType.CAMPAIGN_EXECUTION, "node-b:2", now.plusSeconds(30), now);
        entityManager.clear();

        // Then
        assertThat(updated).isEqualTo(1);
        assertThat(stored("variant_processing_gid://shopify/ProductVariant/1"))
                .get()
                .extracting(ProcessingLock::getOwnerToken)
                .isEqualTo("node-b:2");
    }

    @Test
    @DisplayName("reclaimExpired - Should leave a held lock alone")
    void reclaimExpired_HeldLock_NoUpdate() {
        // Given
        lock("webhook_msg-1", "node-a:1", now.plusSeconds(10));

        // When
        int updated = lockRepository.reclaimExpired("webhook_msg-1",
                LockType.WEBHOOK_PROCESSING, "node-b:2", now.plusSeconds(30), now);
        entityManager.clear();

        // Then
        assertThat(updated).isZero();
        assertThat(stored("webhook_msg-1"))
                .get()
                .extracting(ProcessingLock::getOwnerToken)
                .isEqualTo("node-a:1");
    }

    @Test
    @DisplayName("deleteOwned - Should only release when the owner token matches")
    void deleteOwned_OnlyOwner() {
        // Given
        lock("webhook_msg-2", "node-a:1", now.plusSeconds(10));

        // When / Then
        assertThat(lockRepository.deleteOwned("webhook_msg-2", "node-b:2")).isZero();
        assertThat(lockRepository.deleteOwned("webhook_msg-2", "node-a:1")).isEqualTo(1);
        entityManager.clear();
        assertThat(stored("webhook_msg-2")).isEmpty();
    }

    @Test
    @DisplayName("deleteExpired - Should purge only expired locks")
    void deleteExpired_PurgesExpiredOnly() {
        // Given
        lock("webhook_old", "node-a:1", now.minusSeconds(60));
        lock("webhook_at_expiry", "node-a:2", now);
        lock("webhook_live", "node-a:3", now.plusSeconds(60));

        // When
        int purged = lockRepository.deleteExpired(now);
        entityManager.clear();

        // Then
        assertThat(purged).isEqualTo(2);
        assertThat(lockRepository.findAll())
                .extracting(ProcessingLock::getLockKey)
                .containsExactly("webhook_live");
    }

    @Test
    @DisplayName("Unique lock key - Should reject a second row for the same key")
    void duplicateKey_Rejected() {
        // Given
        lock("webhook_msg-3", "node-a:1", now.plusSeconds(10));

        // When / Then
        assertThatThrownBy(() -> lock("webhook_msg-3", "node-b:2", now.plusSeconds(10)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
