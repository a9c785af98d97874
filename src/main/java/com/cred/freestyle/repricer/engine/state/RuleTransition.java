package com.cred.freestyle.repricer.engine.state;

import com.cred.freestyle.repricer.domain.model.RuleExecutionState;

/**
 * Result of applying one observation to a rule's execution state.
 *
 * @author Repricer Team
 */
public class RuleTransition {

    private final boolean shouldExecute;
    private final String reason;
    private final RuleExecutionState state;

    public RuleTransition(boolean shouldExecute, String reason, RuleExecutionState state) {
        this.shouldExecute = shouldExecute;
        this.reason = reason;
        this.state = state;
    }

    public boolean shouldExecute() {
        return shouldExecute;
    }

    public String getReason() {
        return reason;
    }

    /**
     * The new state to persist; a fresh object, never the prior instance.
     */
    public RuleExecutionState getState() {
        return state;
    }
}
