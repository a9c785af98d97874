package com.cred.freestyle.repricer.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Engine metrics, published to AWS CloudWatch through Micrometer.
 *
 * Key Metrics:
 * - Event outcomes by status (processed, duplicate, echo, contention, ...)
 * - Campaign results by status
 * - Price updates applied / failed
 * - Degraded rule evaluations
 * - End-to-end event latency
 * - Errors and cleanup volume
 *
 * @author Repricer Team
 */
@Service
public class RepricerMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(RepricerMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "repricer.";
    private static final String EVENT_PREFIX = METRIC_PREFIX + "event.";
    private static final String CAMPAIGN_PREFIX = METRIC_PREFIX + "campaign.";
    private static final String PRICE_PREFIX = METRIC_PREFIX + "price.";

    public RepricerMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record the overall outcome of an inbound event.
     *
     * @param topic Webhook topic
     * @param status Outcome status name
     */
    public void recordEventOutcome(String topic, String status) {
        Counter.builder(EVENT_PREFIX + "outcome")
                .tag("topic", topic != null ? topic : "unknown")
                .tag("status", status)
                .description("Processed inbound events by outcome")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded event outcome: {} ({})", status, topic);
    }

    /**
     * Record event processing latency.
     *
     * @param durationMs Processing time in milliseconds
     */
    public void recordEventLatency(long durationMs) {
        Timer.builder(EVENT_PREFIX + "latency")
                .description("End-to-end event processing latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record the result of one campaign for one event.
     *
     * @param status Campaign result status name
     */
    public void recordCampaignResult(String status) {
        Counter.builder(CAMPAIGN_PREFIX + "result")
                .tag("status", status)
                .description("Campaign evaluations by result")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an applied price change.
     *
     * @param shopDomain Shop the variant belongs to
     */
    public void recordPriceUpdate(String shopDomain) {
        Counter.builder(PRICE_PREFIX + "updated")
                .tag("shop", shopDomain)
                .description("Variant prices changed by the engine")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded price update for shop: {}", shopDomain);
    }

    /**
     * Record a price change rejected by the platform or lost in transport.
     *
     * @param shopDomain Shop the variant belongs to
     */
    public void recordPriceUpdateFailure(String shopDomain) {
        Counter.builder(PRICE_PREFIX + "failed")
                .tag("shop", shopDomain)
                .description("Failed variant price changes")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a rule evaluation that fell back to the stateless level check.
     *
     * @param operation State store operation that failed
     */
    public void recordDegradedEvaluation(String operation) {
        Counter.builder(METRIC_PREFIX + "rule.degraded")
                .tag("operation", operation)
                .description("Rule evaluations decided without persisted state")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded degraded evaluation ({})", operation);
    }

    /**
     * Record expired records removed by cleanup.
     *
     * @param recordType "lock" or "cooldown"
     * @param count Number of records removed
     */
    public void recordCleanup(String recordType, int count) {
        Counter.builder(METRIC_PREFIX + "cleanup.purged")
                .tag("record_type", recordType)
                .description("Expired records purged")
                .register(meterRegistry)
                .increment(count);
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Error type
     * @param operation Operation that failed
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("System errors")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded error: {} in {}", errorType, operation);
    }
}
