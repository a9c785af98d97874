package com.cred.freestyle.repricer.engine.state;

import com.cred.freestyle.repricer.config.EngineProperties;
import com.cred.freestyle.repricer.domain.model.Campaign;
import com.cred.freestyle.repricer.domain.model.PricingRule;
import com.cred.freestyle.repricer.domain.model.RuleExecutionState;
import com.cred.freestyle.repricer.domain.model.WhenCondition;
import com.cred.freestyle.repricer.gateway.VariantSnapshot;
import com.cred.freestyle.repricer.repository.RuleExecutionStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Evaluates a rule against a variant observation using its persisted execution state.
 *
 * When the state store cannot be read or written, the evaluation falls back to a stateless level
 * check (condition true means execute) and is returned as {@link EvaluationMode#DEGRADED}. This keeps
 * the engine available at the cost of possibly firing again on a sustained condition.
 *
 * @author Repricer Team
 */
@Service
public class RuleEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(RuleEvaluator.class);

    private final RuleExecutionStateRepository stateRepository;
    private final RuleStateMachine stateMachine;
    private final Clock clock;

    public RuleEvaluator(RuleExecutionStateRepository stateRepository, Clock clock,
                         EngineProperties engineProperties) {
        this.stateRepository = stateRepository;
        this.stateMachine = new RuleStateMachine(engineProperties.getRuleRetriggerInterval());
        this.clock = clock;
    }

    /**
     * Evaluate a rule.
     *
     * @param rule Rule to evaluate
     * @param campaign Campaign owning the rule
     * @param snapshot Current variant observation
     * @return Evaluation, never null
     */
    public RuleEvaluation evaluate(PricingRule rule, Campaign campaign, VariantSnapshot snapshot) {
        Instant now = clock.instant();
        String variantId = snapshot.getVariantId();

        RuleExecutionState prior;
        try {
            prior = stateRepository
                    .findByCampaignIdAndRuleIdAndVariantId(campaign.getCampaignId(), rule.getRuleId(), variantId)
                    .orElse(null);
        } catch (DataAccessException e) {
            logger.error("Rule state lookup failed for rule {} / variant {}, using fallback evaluation",
                    rule.getRuleId(), variantId, e);
            return fallback(rule, snapshot, new EvaluationError("load", e));
        }

        RuleTransition transition = stateMachine.transition(
                prior, rule, campaign.getCampaignId(), campaign.getShopDomain(), snapshot, now);

        try {
            stateRepository.save(transition.getState());
        } catch (DataAccessException e) {
            logger.error("Rule state save failed for rule {} / variant {}, using fallback evaluation",
                    rule.getRuleId(), variantId, e);
            return fallback(rule, snapshot, new EvaluationError("save", e));
        }

        logger.debug("Rule {} on variant {}: {} ({})",
                rule.getRuleId(), variantId, transition.getState().getState(), transition.getReason());
        return RuleEvaluation.evaluated(rule, transition);
    }

    private RuleEvaluation fallback(PricingRule rule, VariantSnapshot snapshot, EvaluationError error) {
        WhenCondition condition = rule.resolveCondition();
        int inventory = snapshot.getInventoryQuantity();
        boolean matches = condition.matches(inventory, rule.whenValueAsDecimal());
        String reason = String.format("inventory %d %s %s %s (state store unavailable: %s)",
                inventory,
                matches ? "is" : "is not",
                rule.getWhenCondition(),
                rule.whenValueAsDecimal().toPlainString(),
                error);
        return RuleEvaluation.degraded(rule, matches, reason, error);
    }
}
