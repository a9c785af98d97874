package com.cred.freestyle.repricer.repository;

import com.cred.freestyle.repricer.domain.model.PriceCooldown;
import com.cred.freestyle.repricer.domain.model.PriceCooldown.CooldownType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for PriceCooldown entity.
 *
 * @author Repricer Team
 */
@Repository
public interface PriceCooldownRepository extends JpaRepository<PriceCooldown, String> {

    /**
     * Whether a non-expired cooldown exists for the key and type.
     */
    boolean existsByCooldownKeyAndCooldownTypeAndExpiresAtAfter(
            String cooldownKey,
            CooldownType cooldownType,
            Instant now
    );

    /**
     * Extend an existing cooldown in place.
     *
     * @return Number of rows updated (0 when no record exists yet)
     */
    @Modifying
    @Transactional
    @Query("UPDATE PriceCooldown c SET c.expiresAt = :expiresAt, c.campaignId = :campaignId, " +
           "c.updatedAt = :now WHERE c.cooldownKey = :cooldownKey AND c.cooldownType = :cooldownType")
    int updateExpiry(
            @Param("cooldownKey") String cooldownKey,
            @Param("cooldownType") CooldownType cooldownType,
            @Param("campaignId") String campaignId,
            @Param("expiresAt") Instant expiresAt,
            @Param("now") Instant now
    );

    @Modifying
    @Transactional
    @Query("DELETE FROM PriceCooldown c WHERE c.cooldownKey = :cooldownKey AND c.cooldownType = :cooldownType")
    int deleteByKeyAndType(
            @Param("cooldownKey") String cooldownKey,
            @Param("cooldownType") CooldownType cooldownType
    );

    @Modifying
    @Transactional
    @Query("DELETE FROM PriceCooldown c WHERE c.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);

    @Query("SELECT c FROM PriceCooldown c WHERE c.expiresAt > :now ORDER BY c.expiresAt ASC")
    List<PriceCooldown> findActive(@Param("now") Instant now);
}
