package com.cred.freestyle.repricer.engine.state;

import com.cred.freestyle.repricer.domain.model.PricingRule;
import com.cred.freestyle.repricer.domain.model.RuleExecutionState;

/**
 * Outcome of evaluating one rule for one variant.
 *
 * A DEGRADED evaluation carries the {@link EvaluationError} that forced it and a reason prefixed
 * with {@value #FALLBACK_PREFIX}.
 *
 * @author Repricer Team
 */
public class RuleEvaluation {

    public static final String FALLBACK_PREFIX = "FALLBACK: ";

    private final PricingRule rule;
    private final EvaluationMode mode;
    private final boolean shouldExecute;
    private final String reason;
    private final RuleExecutionState state;
    private final EvaluationError error;

    private RuleEvaluation(PricingRule rule, EvaluationMode mode, boolean shouldExecute, String reason,
                           RuleExecutionState state, EvaluationError error) {
        this.rule = rule;
        this.mode = mode;
        this.shouldExecute = shouldExecute;
        this.reason = reason;
        this.state = state;
        this.error = error;
    }

    public static RuleEvaluation evaluated(PricingRule rule, RuleTransition transition) {
        return new RuleEvaluation(rule, EvaluationMode.EVALUATED, transition.shouldExecute(),
                transition.getReason(), transition.getState(), null);
    }

    public static RuleEvaluation degraded(PricingRule rule, boolean shouldExecute, String reason,
                                          EvaluationError error) {
        return new RuleEvaluation(rule, EvaluationMode.DEGRADED, shouldExecute,
                FALLBACK_PREFIX + reason, null, error);
    }

    public PricingRule getRule() {
        return rule;
    }

    public EvaluationMode getMode() {
        return mode;
    }

    public boolean isDegraded() {
        return mode == EvaluationMode.DEGRADED;
    }

    public boolean shouldExecute() {
        return shouldExecute;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Persisted state after the evaluation; null when degraded.
     */
    public RuleExecutionState getState() {
        return state;
    }

    public EvaluationError getError() {
        return error;
    }
}
