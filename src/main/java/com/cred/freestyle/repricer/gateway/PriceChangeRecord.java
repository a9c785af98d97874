package com.cred.freestyle.repricer.gateway;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * An applied price change, as handed to the {@link AuditRecorder}.
 *
 * @author Repricer Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceChangeRecord {

    private String shopDomain;
    private String variantId;
    private String productId;
    private String campaignId;
    private String campaignName;
    private String ruleId;
    private BigDecimal oldPrice;
    private BigDecimal newPrice;

    /**
     * Null when the rule did not touch the compare-at price.
     */
    private BigDecimal oldCompareAt;
    private BigDecimal newCompareAt;

    private String reason;
    private String sourceMessageId;
}
