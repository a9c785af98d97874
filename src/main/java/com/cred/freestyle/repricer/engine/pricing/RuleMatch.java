package com.cred.freestyle.repricer.engine.pricing;

import com.cred.freestyle.repricer.domain.model.PricingRule;
import com.cred.freestyle.repricer.engine.state.RuleEvaluation;

/**
 * A rule whose evaluation decided it should execute.
 *
 * @author Repricer Team
 */
public class RuleMatch {

    private final PricingRule rule;
    private final RuleEvaluation evaluation;

    public RuleMatch(PricingRule rule, RuleEvaluation evaluation) {
        this.rule = rule;
        this.evaluation = evaluation;
    }

    public PricingRule getRule() {
        return rule;
    }

    public RuleEvaluation getEvaluation() {
        return evaluation;
    }

    public String getReason() {
        return evaluation != null ? evaluation.getReason() : null;
    }
}
