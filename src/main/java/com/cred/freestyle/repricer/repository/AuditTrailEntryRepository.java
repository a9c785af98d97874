package com.cred.freestyle.repricer.repository;

import com.cred.freestyle.repricer.domain.model.AuditTrailEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for AuditTrailEntry entity. Entries are only ever inserted.
 *
 * @author Repricer Team
 */
@Repository
public interface AuditTrailEntryRepository extends JpaRepository<AuditTrailEntry, String> {

    List<AuditTrailEntry> findByEntityTypeAndEntityIdOrderByCreatedAtDesc(String entityType, String entityId);

    List<AuditTrailEntry> findByCampaignIdOrderByCreatedAtDesc(String campaignId);
}
