package com.cred.freestyle.repricer.engine.state;

import com.cred.freestyle.repricer.domain.model.PricingRule;
import com.cred.freestyle.repricer.domain.model.RuleExecutionState;
import com.cred.freestyle.repricer.domain.model.RuleExecutionState.RuleState;
import com.cred.freestyle.repricer.domain.model.WhenCondition;
import com.cred.freestyle.repricer.gateway.VariantSnapshot;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Threshold-crossing state machine for a single (campaign, rule, variant).
 *
 * A rule executes only when its condition is newly true: true for the current inventory and false
 * for the inventory captured on the previous evaluation (or there is no previous evaluation).
 * While the condition stays true the rule does not fire again; it re-arms once the condition has
 * been observed false.
 *
 * Pure: no I/O, the caller loads and persists the state.
 *
 * @author Repricer Team
 */
public class RuleStateMachine {

    private final Duration retriggerInterval;

    public RuleStateMachine() {
        this(Duration.ZERO);
    }

    /**
     * @param retriggerInterval Minimum spacing between two triggers of the same rule and variant;
     *                          a crossing inside it moves the state to COOLING_DOWN without executing,
     *                          and it executes on the first observation after the interval if the
     *                          condition still holds
     */
    public RuleStateMachine(Duration retriggerInterval) {
        this.retriggerInterval = retriggerInterval == null ? Duration.ZERO : retriggerInterval;
    }

    /**
     * Apply an observation.
     *
     * @param prior State from the previous evaluation, null on the first evaluation
     * @param rule Rule being evaluated
     * @param campaignId Campaign the rule belongs to
     * @param shopDomain Shop of the variant
     * @param snapshot Current variant observation
     * @param now Evaluation time
     * @return Decision and the new state
     */
    public RuleTransition transition(RuleExecutionState prior, PricingRule rule, String campaignId,
                                     String shopDomain, VariantSnapshot snapshot, Instant now) {
        WhenCondition condition = rule.resolveCondition();
        BigDecimal threshold = rule.whenValueAsDecimal();
        int inventory = snapshot.getInventoryQuantity();

        RuleExecutionState next = prior != null ? prior.copy() : RuleExecutionState.builder()
                .campaignId(campaignId)
                .ruleId(rule.getRuleId())
                .variantId(snapshot.getVariantId())
                .shopDomain(shopDomain)
                .state(RuleState.INACTIVE)
                .triggerCount(0)
                .createdAt(now)
                .build();

        Integer lastInventory = prior != null ? prior.getLastInventoryValue() : null;
        boolean matchesNow = condition.matches(inventory, threshold);
        boolean matchedBefore = lastInventory != null && condition.matches(lastInventory, threshold);

        boolean shouldExecute = false;
        String reason;

        if (matchesNow && !matchedBefore) {
            if (insideRetriggerInterval(prior, now)) {
                Instant until = prior.getTriggeredAt().plus(retriggerInterval);
                next.setState(RuleState.COOLING_DOWN);
                next.setCooldownUntil(until);
                reason = String.format("Inventory %d crossed %s %s but rule is cooling down until %s",
                        inventory, describe(rule), threshold.toPlainString(), until);
            } else {
                shouldExecute = true;
                trigger(next, inventory, now);
                reason = lastInventory == null
                        ? String.format("Inventory %d is %s %s (first observation)",
                                inventory, describe(rule), threshold.toPlainString())
                        : String.format("Inventory crossed threshold: %d -> %d is %s %s",
                                lastInventory, inventory, describe(rule), threshold.toPlainString());
            }
        } else if (matchesNow && cooldownElapsed(prior, now)) {
            // Crossing deferred by the re-trigger interval, still true once the interval is over
            shouldExecute = true;
            trigger(next, inventory, now);
            reason = String.format("Inventory %d is %s %s after deferred crossing (cooldown ended %s)",
                    inventory, describe(rule), threshold.toPlainString(), prior.getCooldownUntil());
        } else if (matchesNow) {
            reason = String.format("Condition still true (inventory %d, previously %d); already handled",
                    inventory, lastInventory);
        } else {
            next.setState(afterFalseObservation(next.getState()));
            reason = String.format("Condition not met: inventory %d is not %s %s",
                    inventory, describe(rule), threshold.toPlainString());
        }

        next.setLastInventoryValue(inventory);
        next.setLastPriceValue(snapshot.getPrice());
        next.setUpdatedAt(now);
        return new RuleTransition(shouldExecute, reason, next);
    }

    private void trigger(RuleExecutionState next, int inventory, Instant now) {
        next.setState(RuleState.TRIGGERED);
        next.setTriggerCount(next.getTriggerCount() + 1);
        next.setTriggeredAt(now);
        next.setLastTriggerValue(inventory);
        next.setCooldownUntil(retriggerInterval.isZero() ? null : now.plus(retriggerInterval));
    }

    private static boolean cooldownElapsed(RuleExecutionState prior, Instant now) {
        return prior != null
                && prior.getState() == RuleState.COOLING_DOWN
                && prior.getCooldownUntil() != null
                && !now.isBefore(prior.getCooldownUntil());
    }

    private boolean insideRetriggerInterval(RuleExecutionState prior, Instant now) {
        if (retriggerInterval.isZero() || retriggerInterval.isNegative()
                || prior == null || prior.getTriggeredAt() == null) {
            return false;
        }
        return now.isBefore(prior.getTriggeredAt().plus(retriggerInterval));
    }

    private static RuleState afterFalseObservation(RuleState current) {
        if (current == RuleState.TRIGGERED) {
            return RuleState.RESET_PENDING;
        }
        return RuleState.INACTIVE;
    }

    private static String describe(PricingRule rule) {
        return rule.getWhenCondition();
    }
}
