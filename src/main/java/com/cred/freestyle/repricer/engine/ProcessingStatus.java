package com.cred.freestyle.repricer.engine;

/**
 * Overall result of processing one inbound event. Everything except PROCESSED is a short-circuit.
 *
 * @author Repricer Team
 */
public enum ProcessingStatus {
    /**
     * Campaigns were evaluated; see the per-campaign results.
     */
    PROCESSED,
    ALREADY_PROCESSED,
    SELF_ECHO,
    NO_ACTIVE_CAMPAIGNS,
    UNSUPPORTED_EVENT,
    EXTRACTION_FAILED,
    VARIANT_LOCKED,
    VARIANT_COOLING_DOWN,
    VARIANT_UNAVAILABLE,
    UNTRACKED_INVENTORY
}
