package com.cred.freestyle.repricer.engine.state;

/**
 * How a rule evaluation was decided.
 *
 * @author Repricer Team
 */
public enum EvaluationMode {

    /**
     * Threshold-crossing decision against persisted rule state.
     */
    EVALUATED,

    /**
     * State store unavailable; decided by a stateless level check. May fire again on a condition
     * that was already true on the previous event.
     */
    DEGRADED
}
