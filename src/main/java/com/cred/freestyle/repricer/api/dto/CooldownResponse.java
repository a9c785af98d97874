package com.cred.freestyle.repricer.api.dto;

import com.cred.freestyle.repricer.domain.model.PriceCooldown;

import java.time.Instant;

/**
 * An active cooldown as shown to operators.
 *
 * @author Repricer Team
 */
public class CooldownResponse {

    private String cooldownKey;
    private String cooldownType;
    private String campaignId;
    private Instant expiresAt;
    private long remainingSeconds;

    public CooldownResponse() {
    }

    public CooldownResponse(String cooldownKey, String cooldownType, String campaignId,
                            Instant expiresAt, long remainingSeconds) {
        this.cooldownKey = cooldownKey;
        this.cooldownType = cooldownType;
        this.campaignId = campaignId;
        this.expiresAt = expiresAt;
        this.remainingSeconds = remainingSeconds;
    }

    /**
     * Create response from a cooldown record.
     *
     * @param cooldown Active cooldown
     * @param now Reference time for the remaining duration
     * @return CooldownResponse
     */
    public static CooldownResponse from(PriceCooldown cooldown, Instant now) {
        long remaining = Math.max(0, cooldown.getExpiresAt().getEpochSecond() - now.getEpochSecond());
        return new CooldownResponse(
                cooldown.getCooldownKey(),
                cooldown.getCooldownType().name(),
                cooldown.getCampaignId(),
                cooldown.getExpiresAt(),
                remaining
        );
    }

    public String getCooldownKey() {
        return cooldownKey;
    }

    public void setCooldownKey(String cooldownKey) {
        this.cooldownKey = cooldownKey;
    }

    public String getCooldownType() {
        return cooldownType;
    }

    public void setCooldownType(String cooldownType) {
        this.cooldownType = cooldownType;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public void setCampaignId(String campaignId) {
        this.campaignId = campaignId;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public long getRemainingSeconds() {
        return remainingSeconds;
    }

    public void setRemainingSeconds(long remainingSeconds) {
        this.remainingSeconds = remainingSeconds;
    }
}
