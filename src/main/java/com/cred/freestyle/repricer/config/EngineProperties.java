package com.cred.freestyle.repricer.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Deployment-level tunables of the rule execution engine.
 * TTLs bound how long a crashed instance can block a key and how closely automated price changes
 * on the same variant or campaign can follow each other.
 *
 * @author Repricer Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineProperties {

    /**
     * Identifier of this processing instance, written into lock owner tokens.
     */
    @Builder.Default
    private String instanceId = "repricer-local";

    @Builder.Default
    private Duration webhookLockTtl = Duration.ofSeconds(60);

    @Builder.Default
    private Duration variantLockTtl = Duration.ofSeconds(120);

    @Builder.Default
    private Duration variantCooldownTtl = Duration.ofMinutes(2);

    @Builder.Default
    private Duration campaignCooldownTtl = Duration.ofMinutes(1);

    /**
     * Fraction of processed events that also purge expired locks and cooldowns (0.0 - 1.0).
     */
    @Builder.Default
    private double cleanupProbability = 0.1;

    /**
     * A product payload variant updated within this window of now is treated as our own echo.
     */
    @Builder.Default
    private Duration echoWindow = Duration.ofSeconds(60);

    /**
     * Minimum spacing between two triggers of the same rule on the same variant. Zero disables it.
     */
    @Builder.Default
    private Duration ruleRetriggerInterval = Duration.ZERO;

    public static EngineProperties defaults() {
        return EngineProperties.builder().build();
    }
}
