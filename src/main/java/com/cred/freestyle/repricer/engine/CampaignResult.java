package com.cred.freestyle.repricer.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * What happened to one campaign while processing an event.
 *
 * @author Repricer Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignResult {

    private String campaignId;
    private String campaignName;
    private Status status;

    /**
     * Rule that was applied (or attempted); null when no rule was selected.
     */
    private String ruleId;
    private String reason;

    /**
     * True when the applied rule was selected by a degraded evaluation.
     */
    private boolean degraded;

    private BigDecimal oldPrice;
    private BigDecimal newPrice;
    private BigDecimal oldCompareAtPrice;
    private BigDecimal newCompareAtPrice;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    private long processingTimeMs;

    public enum Status {
        UPDATED,
        FAILED,
        SKIPPED_COOLDOWN,
        NOT_TARGETED,
        NO_APPLICABLE_RULE
    }
}
