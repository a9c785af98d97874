package com.cred.freestyle.repricer.infrastructure.messaging.events;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event published after the engine changed a variant's price.
 * Keyed by variant id so that changes to the same variant stay ordered.
 *
 * @author Repricer Team
 */
public class PriceChangeEvent {

    private String shopDomain;
    private String variantId;
    private String productId;
    private String campaignId;
    private String ruleId;
    private BigDecimal oldPrice;
    private BigDecimal newPrice;
    private BigDecimal newCompareAtPrice;
    private String reason;
    private String sourceMessageId;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public PriceChangeEvent() {
    }

    public PriceChangeEvent(
            String shopDomain,
            String variantId,
            String productId,
            String campaignId,
            String ruleId,
            BigDecimal oldPrice,
            BigDecimal newPrice,
            BigDecimal newCompareAtPrice,
            String reason,
            String sourceMessageId,
            Instant timestamp
    ) {
        this.shopDomain = shopDomain;
        this.variantId = variantId;
        this.productId = productId;
        this.campaignId = campaignId;
        this.ruleId = ruleId;
        this.oldPrice = oldPrice;
        this.newPrice = newPrice;
        this.newCompareAtPrice = newCompareAtPrice;
        this.reason = reason;
        this.sourceMessageId = sourceMessageId;
        this.timestamp = timestamp;
    }

    // Getters and setters
    public String getShopDomain() {
        return shopDomain;
    }

    public void setShopDomain(String shopDomain) {
        this.shopDomain = shopDomain;
    }

    public String getVariantId() {
        return variantId;
    }

    public void setVariantId(String variantId) {
        this.variantId = variantId;
    }

    public String getProductId() {
        return productId;
    }

    public void setProductId(String productId) {
        this.productId = productId;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public void setCampaignId(String campaignId) {
        this.campaignId = campaignId;
    }

    public String getRuleId() {
        return ruleId;
    }

    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
    }

    public BigDecimal getOldPrice() {
        return oldPrice;
    }

    public void setOldPrice(BigDecimal oldPrice) {
        this.oldPrice = oldPrice;
    }

    public BigDecimal getNewPrice() {
        return newPrice;
    }

    public void setNewPrice(BigDecimal newPrice) {
        this.newPrice = newPrice;
    }

    public BigDecimal getNewCompareAtPrice() {
        return newCompareAtPrice;
    }

    public void setNewCompareAtPrice(BigDecimal newCompareAtPrice) {
        this.newCompareAtPrice = newCompareAtPrice;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getSourceMessageId() {
        return sourceMessageId;
    }

    public void setSourceMessageId(String sourceMessageId) {
        this.sourceMessageId = sourceMessageId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "PriceChangeEvent{" +
                "variantId='" + variantId + '\'' +
                ", campaignId='" + campaignId + '\'' +
                ", oldPrice=" + oldPrice +
                ", newPrice=" + newPrice +
                ", sourceMessageId='" + sourceMessageId + '\'' +
                '}';
    }
}
