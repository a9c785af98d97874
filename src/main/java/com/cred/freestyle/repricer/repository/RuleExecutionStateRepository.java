package com.cred.freestyle.repricer.repository;

import com.cred.freestyle.repricer.domain.model.RuleExecutionState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for RuleExecutionState entity.
 *
 * @author Repricer Team
 */
@Repository
public interface RuleExecutionStateRepository extends JpaRepository<RuleExecutionState, String> {

    Optional<RuleExecutionState> findByCampaignIdAndRuleIdAndVariantId(
            String campaignId,
            String ruleId,
            String variantId
    );

    List<RuleExecutionState> findByVariantIdOrderByUpdatedAtDesc(String variantId);
}
