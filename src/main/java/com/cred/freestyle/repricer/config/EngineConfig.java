package com.cred.freestyle.repricer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Rule execution engine configuration.
 * Durations are ISO-8601 strings (e.g. PT60S).
 *
 * @author Repricer Team
 */
@Configuration
public class EngineConfig {

    @Value("${repricer.instance-id:repricer-local}")
    private String instanceId;

    @Value("${repricer.lock.webhook-ttl:PT60S}")
    private String webhookLockTtl;

    @Value("${repricer.lock.variant-ttl:PT120S}")
    private String variantLockTtl;

    @Value("${repricer.cooldown.variant-ttl:PT2M}")
    private String variantCooldownTtl;

    @Value("${repricer.cooldown.campaign-ttl:PT1M}")
    private String campaignCooldownTtl;

    @Value("${repricer.cleanup.probability:0.1}")
    private double cleanupProbability;

    @Value("${repricer.echo-window:PT60S}")
    private String echoWindow;

    @Value("${repricer.rule.retrigger-interval:PT0S}")
    private String ruleRetriggerInterval;

    /**
     * Wall clock used by every time-dependent engine component.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EngineProperties engineProperties() {
        return EngineProperties.builder()
                .instanceId(instanceId)
                .webhookLockTtl(Duration.parse(webhookLockTtl))
                .variantLockTtl(Duration.parse(variantLockTtl))
                .variantCooldownTtl(Duration.parse(variantCooldownTtl))
                .campaignCooldownTtl(Duration.parse(campaignCooldownTtl))
                .cleanupProbability(cleanupProbability)
                .echoWindow(Duration.parse(echoWindow))
                .ruleRetriggerInterval(Duration.parse(ruleRetriggerInterval))
                .build();
    }
}
