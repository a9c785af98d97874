package com.cred.freestyle.repricer.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregated result of processing one inbound event.
 *
 * @author Repricer Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingOutcome {

    private String messageId;
    private String topic;
    private String shopDomain;
    private ProcessingStatus status;
    private String variantId;
    private String productId;

    /**
     * Human readable detail for short-circuits.
     */
    private String message;

    @Builder.Default
    private List<CampaignResult> campaignResults = new ArrayList<>();

    private long processingTimeMs;

    /**
     * @return true if at least one campaign changed the price
     */
    public boolean isSuccess() {
        return getUpdatedCount() > 0;
    }

    public int getProcessedCount() {
        return campaignResults.size();
    }

    public int getUpdatedCount() {
        return count(CampaignResult.Status.UPDATED);
    }

    public int getFailedCount() {
        return count(CampaignResult.Status.FAILED);
    }

    public int getSkippedCount() {
        return getProcessedCount() - getUpdatedCount() - getFailedCount();
    }

    private int count(CampaignResult.Status status) {
        int count = 0;
        for (CampaignResult result : campaignResults) {
            if (result.getStatus() == status) {
                count++;
            }
        }
        return count;
    }
}
