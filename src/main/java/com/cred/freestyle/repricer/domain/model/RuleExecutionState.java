package com.cred.freestyle.repricer.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Execution state of one rule for one variant.
 *
 * One row exists per (campaign, rule, variant). It is created on the first evaluation, updated on
 * every later evaluation and never deleted by the engine, so the history of a threshold crossing can
 * be inspected after the fact.
 *
 * State transitions:
 * - INACTIVE / RESET_PENDING / no row + condition newly true -> TRIGGERED
 * - TRIGGERED + condition false -> RESET_PENDING
 * - RESET_PENDING + condition false -> INACTIVE
 * - crossing inside the re-trigger interval -> COOLING_DOWN (only when an interval is configured)
 *
 * @author Repricer Team
 */
@Entity
@Table(name = "rule_execution_states",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_rule_state_campaign_rule_variant",
                columnNames = {"campaign_id", "rule_id", "variant_id"})
    },
    indexes = {
        @Index(name = "idx_rule_state_variant", columnList = "variant_id"),
        @Index(name = "idx_rule_state_state", columnList = "state")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleExecutionState {

    @Id
    @Column(name = "state_id", nullable = false, length = 36)
    private String stateId;

    @Column(name = "campaign_id", nullable = false, length = 36)
    private String campaignId;

    @Column(name = "rule_id", nullable = false, length = 36)
    private String ruleId;

    @Column(name = "variant_id", nullable = false, length = 255)
    private String variantId;

    @Column(name = "shop_domain", length = 255)
    private String shopDomain;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    @Builder.Default
    private RuleState state = RuleState.INACTIVE;

    /**
     * Inventory observed on the previous evaluation; null until the first evaluation completes.
     */
    @Column(name = "last_inventory_value")
    private Integer lastInventoryValue;

    @Column(name = "last_price_value", precision = 12, scale = 2)
    private BigDecimal lastPriceValue;

    /**
     * Inventory value that caused the most recent trigger.
     */
    @Column(name = "last_trigger_value")
    private Integer lastTriggerValue;

    @Column(name = "triggered_at")
    private Instant triggeredAt;

    @Column(name = "cooldown_until")
    private Instant cooldownUntil;

    @Column(name = "trigger_count", nullable = false)
    @Builder.Default
    private Integer triggerCount = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (stateId == null) {
            stateId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Copy of this state, used by the state machine so that the prior observation stays untouched.
     */
    public RuleExecutionState copy() {
        return RuleExecutionState.builder()
                .stateId(stateId)
                .campaignId(campaignId)
                .ruleId(ruleId)
                .variantId(variantId)
                .shopDomain(shopDomain)
                .state(state)
                .lastInventoryValue(lastInventoryValue)
                .lastPriceValue(lastPriceValue)
                .lastTriggerValue(lastTriggerValue)
                .triggeredAt(triggeredAt)
                .cooldownUntil(cooldownUntil)
                .triggerCount(triggerCount)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    /**
     * Rule execution state.
     */
    public enum RuleState {
        /**
         * Armed: the next crossing fires the rule.
         */
        INACTIVE,

        /**
         * Fired and the condition is still true.
         */
        TRIGGERED,

        /**
         * A crossing was observed inside the re-trigger interval and was not executed.
         */
        COOLING_DOWN,

        /**
         * Condition went false after a trigger; one more false observation returns to INACTIVE.
         */
        RESET_PENDING
    }
}
