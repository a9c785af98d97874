package com.cred.freestyle.repricer.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A single "when inventory ... then price ..." rule belonging to a campaign.
 *
 * Vocabulary fields are stored as the codes the campaign editor writes ("less_than_abs",
 * "increase_price", "absolute", ...) and resolved through {@link WhenCondition}, {@link ThenAction}
 * and {@link ThenMode}. Numeric values are stored as text so that an unparsable value can be
 * treated as zero instead of failing the whole campaign.
 *
 * @author Repricer Team
 */
@Entity
@Table(name = "pricing_rules", indexes = {
    @Index(name = "idx_rule_campaign", columnList = "campaign_id, position")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingRule {

    @Id
    @Column(name = "rule_id", nullable = false, length = 36)
    private String ruleId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "campaign_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Campaign campaign;

    /**
     * Declaration order inside the campaign; used as the tie-breaker when prioritizing.
     */
    @Column(name = "position", nullable = false)
    private Integer position;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "when_condition", nullable = false, length = 30)
    private String whenCondition;

    /**
     * Display text only ("less than", "more than").
     */
    @Column(name = "when_operator", length = 30)
    private String whenOperator;

    @Column(name = "when_value", nullable = false, length = 30)
    private String whenValue;

    @Column(name = "then_action", nullable = false, length = 30)
    private String thenAction;

    @Column(name = "then_mode", nullable = false, length = 30)
    private String thenMode;

    @Column(name = "then_value", nullable = false, length = 30)
    private String thenValue;

    @Column(name = "change_compare_at", nullable = false)
    @Builder.Default
    private Boolean changeCompareAt = false;

    @PrePersist
    protected void onCreate() {
        if (ruleId == null) {
            ruleId = UUID.randomUUID().toString();
        }
        if (position == null) {
            position = 0;
        }
    }

    public WhenCondition resolveCondition() {
        return WhenCondition.fromCode(whenCondition);
    }

    public ThenAction resolveAction() {
        return ThenAction.fromCode(thenAction);
    }

    public ThenMode resolveMode() {
        return ThenMode.fromCode(thenMode);
    }

    public BigDecimal whenValueAsDecimal() {
        return parseDecimal(whenValue);
    }

    public BigDecimal thenValueAsDecimal() {
        return parseDecimal(thenValue);
    }

    public boolean shouldChangeCompareAt() {
        return Boolean.TRUE.equals(changeCompareAt);
    }

    /**
     * Parse a stored numeric value; anything unparsable counts as zero.
     */
    static BigDecimal parseDecimal(String value) {
        if (value == null || value.isBlank()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }
}
