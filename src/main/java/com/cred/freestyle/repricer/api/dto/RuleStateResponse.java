package com.cred.freestyle.repricer.api.dto;

import com.cred.freestyle.repricer.domain.model.RuleExecutionState;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Execution state of one rule for one variant.
 *
 * @author Repricer Team
 */
public class RuleStateResponse {

    private String campaignId;
    private String ruleId;
    private String variantId;
    private String state;
    private Integer lastInventoryValue;
    private BigDecimal lastPriceValue;
    private Integer lastTriggerValue;
    private Instant triggeredAt;
    private Integer triggerCount;
    private Instant updatedAt;

    public RuleStateResponse() {
    }

    public static RuleStateResponse from(RuleExecutionState executionState) {
        RuleStateResponse response = new RuleStateResponse();
        response.campaignId = executionState.getCampaignId();
        response.ruleId = executionState.getRuleId();
        response.variantId = executionState.getVariantId();
        response.state = executionState.getState() != null ? executionState.getState().name() : null;
        response.lastInventoryValue = executionState.getLastInventoryValue();
        response.lastPriceValue = executionState.getLastPriceValue();
        response.lastTriggerValue = executionState.getLastTriggerValue();
        response.triggeredAt = executionState.getTriggeredAt();
        response.triggerCount = executionState.getTriggerCount();
        response.updatedAt = executionState.getUpdatedAt();
        return response;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getVariantId() {
        return variantId;
    }

    public String getState() {
        return state;
    }

    public Integer getLastInventoryValue() {
        return lastInventoryValue;
    }

    public BigDecimal getLastPriceValue() {
        return lastPriceValue;
    }

    public Integer getLastTriggerValue() {
        return lastTriggerValue;
    }

    public Instant getTriggeredAt() {
        return triggeredAt;
    }

    public Integer getTriggerCount() {
        return triggerCount;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
