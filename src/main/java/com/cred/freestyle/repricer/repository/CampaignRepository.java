package com.cred.freestyle.repricer.repository;

import com.cred.freestyle.repricer.domain.model.Campaign;
import com.cred.freestyle.repricer.domain.model.Campaign.CampaignStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for Campaign entity.
 * Campaign definitions are maintained elsewhere; the engine reads active campaigns and bumps counters.
 *
 * @author Repricer Team
 */
@Repository
public interface CampaignRepository extends JpaRepository<Campaign, String> {

    /**
     * Find all campaigns of a shop in a given status, rules fetched in the same query,
     * ordered by campaign priority (lowest first).
     *
     * @param shopDomain Shop/tenant domain
     * @param status Campaign status
     * @return Campaigns with their rules
     */
    @Query("SELECT DISTINCT c FROM Campaign c LEFT JOIN FETCH c.rules " +
           "WHERE c.shopDomain = :shopDomain AND c.status = :status " +
           "ORDER BY c.priority ASC, c.createdAt ASC")
    List<Campaign> findByShopDomainAndStatusWithRules(
            @Param("shopDomain") String shopDomain,
            @Param("status") CampaignStatus status
    );

    /**
     * Find ACTIVE campaigns of a shop including their rules.
     *
     * @param shopDomain Shop/tenant domain
     * @return Active campaigns, lowest priority value first
     */
    default List<Campaign> findActiveByShopDomain(String shopDomain) {
        return findByShopDomainAndStatusWithRules(shopDomain, CampaignStatus.ACTIVE);
    }

    /**
     * Atomically increment a campaign's trigger counter.
     *
     * @param campaignId Campaign ID
     * @param triggeredAt Trigger timestamp
     * @return Number of rows updated (0 or 1)
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Campaign c SET c.triggerCount = c.triggerCount + 1, " +
           "c.lastTriggeredAt = :triggeredAt, c.updatedAt = :triggeredAt " +
           "WHERE c.campaignId = :campaignId")
    int incrementTriggerCount(
            @Param("campaignId") String campaignId,
            @Param("triggeredAt") Instant triggeredAt
    );
}
