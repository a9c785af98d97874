package com.cred.freestyle.repricer.engine;

import com.cred.freestyle.repricer.config.EngineProperties;
import com.cred.freestyle.repricer.domain.model.Campaign;
import com.cred.freestyle.repricer.domain.model.PricingRule;
import com.cred.freestyle.repricer.domain.model.ProcessingLock.LockType;
import com.cred.freestyle.repricer.engine.cooldown.CooldownTracker;
import com.cred.freestyle.repricer.engine.lock.LockLease;
import com.cred.freestyle.repricer.engine.lock.LockManager;
import com.cred.freestyle.repricer.engine.pricing.PriceCalculator;
import com.cred.freestyle.repricer.engine.pricing.RuleMatch;
import com.cred.freestyle.repricer.engine.pricing.RulePrioritizer;
import com.cred.freestyle.repricer.engine.state.RuleEvaluation;
import com.cred.freestyle.repricer.engine.state.RuleEvaluator;
import com.cred.freestyle.repricer.engine.state.VariantStateCapturer;
import com.cred.freestyle.repricer.exception.EventProcessingException;
import com.cred.freestyle.repricer.exception.InvalidEventException;
import com.cred.freestyle.repricer.gateway.AuditRecorder;
import com.cred.freestyle.repricer.gateway.PriceChangeRecord;
import com.cred.freestyle.repricer.gateway.PriceUpdateGateway;
import com.cred.freestyle.repricer.gateway.PriceUpdateResult;
import com.cred.freestyle.repricer.gateway.VariantSnapshot;
import com.cred.freestyle.repricer.infrastructure.messaging.PriceChangePublisher;
import com.cred.freestyle.repricer.infrastructure.messaging.events.PriceChangeEvent;
import com.cred.freestyle.repricer.infrastructure.metrics.RepricerMetricsService;
import com.cred.freestyle.repricer.repository.CampaignRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Processes one inbound inventory-change event end to end.
 *
 * Flow:
 * 1. Per-message lock (duplicate deliveries short-circuit)
 * 2. Self-echo check on product payloads
 * 3. Active campaigns of the shop
 * 4. Topic-specific variant extraction
 * 5. Per-variant lock (concurrent events on the same variant short-circuit)
 * 6. Variant cooldown check
 * 7. Pre-emptive variant cooldown, so our own price write is not reprocessed
 * 8. Per campaign: cooldown, targeting, rule evaluation, prioritization, price update, audit
 * 9. Both locks released on every path; the pre-emptive cooldown is rolled back when nothing
 *    was updated
 *
 * Contention and short-circuits are normal outcomes, not errors, and are never retried here.
 * A failure inside one campaign is recorded and the remaining campaigns still run.
 * Anything unexpected surfaces as {@link EventProcessingException} after cleanup.
 *
 * Not transactional: every store call commits on its own and is visible to other instances at once.
 *
 * @author Repricer Team
 */
@Service
public class EventProcessor {

    private static final Logger logger = LoggerFactory.getLogger(EventProcessor.class);

    static final String WEBHOOK_LOCK_PREFIX = "webhook_";
    static final String VARIANT_LOCK_PREFIX = "variant_processing_";

    private final LockManager lockManager;
    private final CooldownTracker cooldownTracker;
    private final SelfEchoDetector selfEchoDetector;
    private final CampaignRepository campaignRepository;
    private final VariantChangeExtractor variantChangeExtractor;
    private final VariantStateCapturer variantStateCapturer;
    private final TargetMatcher targetMatcher;
    private final RuleEvaluator ruleEvaluator;
    private final PriceUpdateGateway priceUpdateGateway;
    private final AuditRecorder auditRecorder;
    private final PriceChangePublisher priceChangePublisher;
    private final RepricerMetricsService metricsService;
    private final EngineProperties engineProperties;
    private final Clock clock;

    public EventProcessor(
            LockManager lockManager,
            CooldownTracker cooldownTracker,
            SelfEchoDetector selfEchoDetector,
            CampaignRepository campaignRepository,
            VariantChangeExtractor variantChangeExtractor,
            VariantStateCapturer variantStateCapturer,
            TargetMatcher targetMatcher,
            RuleEvaluator ruleEvaluator,
            PriceUpdateGateway priceUpdateGateway,
            AuditRecorder auditRecorder,
            PriceChangePublisher priceChangePublisher,
            RepricerMetricsService metricsService,
            EngineProperties engineProperties,
            Clock clock
    ) {
        this.lockManager = lockManager;
        this.cooldownTracker = cooldownTracker;
        this.selfEchoDetector = selfEchoDetector;
        this.campaignRepository = campaignRepository;
        this.variantChangeExtractor = variantChangeExtractor;
        this.variantStateCapturer = variantStateCapturer;
        this.targetMatcher = targetMatcher;
        this.ruleEvaluator = ruleEvaluator;
        this.priceUpdateGateway = priceUpdateGateway;
        this.auditRecorder = auditRecorder;
        this.priceChangePublisher = priceChangePublisher;
        this.metricsService = metricsService;
        this.engineProperties = engineProperties;
        this.clock = clock;
    }

    /**
     * Process an inbound event.
     *
     * @param event Normalized webhook event
     * @return Outcome, including per-campaign results
     * @throws InvalidEventException if the event lacks a message id, topic or shop
     * @throws EventProcessingException on unexpected failure (locks released, cooldown rolled back)
     */
    public ProcessingOutcome process(InventoryChangeEvent event) {
        validate(event);
        long startTime = System.currentTimeMillis();
        String messageId = event.getMessageId();

        ProcessingOutcome outcome;
        // Step 1: per-message lock
        try (LockLease webhookLease = lockManager.tryAcquire(
                WEBHOOK_LOCK_PREFIX + messageId,
                LockType.WEBHOOK_PROCESSING,
                engineProperties.getWebhookLockTtl()).orElse(null)) {

            if (webhookLease == null) {
                logger.debug("Event {} is already being processed elsewhere", messageId);
                outcome = shortCircuit(event, ProcessingStatus.ALREADY_PROCESSED, null, "message lock held");
            } else {
                maybeCleanup();
                outcome = processLocked(event);
            }
        } catch (EventProcessingException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected error processing event {} ({})", messageId, event.getTopic(), e);
            metricsService.recordError(e.getClass().getSimpleName(), "processEvent");
            throw new EventProcessingException(messageId, event.getTopic(), e);
        }

        long duration = System.currentTimeMillis() - startTime;
        outcome.setProcessingTimeMs(duration);
        metricsService.recordEventOutcome(event.getTopic(), outcome.getStatus().name());
        metricsService.recordEventLatency(duration);
        return outcome;
    }

    private ProcessingOutcome processLocked(InventoryChangeEvent event) {
        String messageId = event.getMessageId();
        String shopDomain = event.getShopDomain();

        // Step 2: our own price write coming back as a product webhook
        Optional<String> echo = selfEchoDetector.detect(event);
        if (echo.isPresent()) {
            logger.info("Event {} is a self-echo: {}", messageId, echo.get());
            return shortCircuit(event, ProcessingStatus.SELF_ECHO, null, echo.get());
        }

        // Step 3: active campaigns
        List<Campaign> campaigns = campaignRepository.findActiveByShopDomain(shopDomain);
        if (campaigns.isEmpty()) {
            logger.debug("No active campaigns for shop {}", shopDomain);
            return shortCircuit(event, ProcessingStatus.NO_ACTIVE_CAMPAIGNS, null, null);
        }

        // Step 4: affected variant
        if (!variantChangeExtractor.supports(event.getTopic())) {
            logger.warn("Ignoring event {} with unsupported topic {}", messageId, event.getTopic());
            return shortCircuit(event, ProcessingStatus.UNSUPPORTED_EVENT, null, "unsupported topic");
        }
        Optional<VariantChange> extracted = variantChangeExtractor.extract(event);
        if (extracted.isEmpty()) {
            logger.warn("Could not extract a variant from event {} ({})", messageId, event.getTopic());
            return shortCircuit(event, ProcessingStatus.EXTRACTION_FAILED, null, "no usable variant in payload");
        }
        VariantChange change = extracted.get();
        String variantId = change.getVariantId();

        // Step 5: per-variant lock
        try (LockLease variantLease = lockManager.tryAcquire(
                VARIANT_LOCK_PREFIX + variantId,
                LockType.CAMPAIGN_EXECUTION,
                engineProperties.getVariantLockTtl()).orElse(null)) {

            if (variantLease == null) {
                logger.debug("Variant {} is being processed by another event", variantId);
                return shortCircuit(event, ProcessingStatus.VARIANT_LOCKED, variantId, "variant lock held");
            }

            // Step 6: variant cooldown
            if (cooldownTracker.isVariantCoolingDown(variantId)) {
                logger.debug("Variant {} is cooling down, skipping event {}", variantId, messageId);
                return shortCircuit(event, ProcessingStatus.VARIANT_COOLING_DOWN, variantId, "variant cooldown active");
            }

            // Step 7: pre-emptive cooldown
            cooldownTracker.setVariantCooldown(variantId, null);
            boolean anyUpdated = false;
            try {
                ProcessingOutcome outcome = evaluateCampaigns(event, change, campaigns);
                anyUpdated = outcome.isSuccess();
                return outcome;
            } finally {
                // Step 9: nothing changed, so the next genuine inventory change must not be blocked
                if (!anyUpdated) {
                    rollbackVariantCooldown(variantId);
                }
            }
        }
    }

    private ProcessingOutcome evaluateCampaigns(InventoryChangeEvent event, VariantChange change,
                                               List<Campaign> campaigns) {
        String shopDomain = event.getShopDomain();

        // Step 8: one observation of the variant for every campaign
        Optional<VariantSnapshot> captured = variantStateCapturer.capture(shopDomain, change);
        if (captured.isEmpty()) {
            logger.warn("Variant {} not found on shop {}", change.getVariantId(), shopDomain);
            return shortCircuit(event, ProcessingStatus.VARIANT_UNAVAILABLE, change.getVariantId(), "variant not found");
        }
        VariantSnapshot snapshot = captured.get();
        if (!snapshot.isInventoryTracked()) {
            logger.debug("Variant {} does not track inventory, excluded from evaluation", snapshot.getVariantId());
            return shortCircuit(event, ProcessingStatus.UNTRACKED_INVENTORY, snapshot.getVariantId(),
                    "inventory not tracked");
        }

        List<CampaignResult> results = new ArrayList<>();
        for (Campaign campaign : campaigns) {
            long campaignStart = System.currentTimeMillis();
            CampaignResult result;
            try {
                result = processCampaign(event, campaign, snapshot);
            } catch (RuntimeException e) {
                logger.error("Campaign {} failed on variant {}", campaign.getCampaignId(), snapshot.getVariantId(), e);
                metricsService.recordError(e.getClass().getSimpleName(), "processCampaign");
                result = CampaignResult.builder()
                        .campaignId(campaign.getCampaignId())
                        .campaignName(campaign.getName())
                        .status(CampaignResult.Status.FAILED)
                        .reason("unexpected error")
                        .errors(List.of(String.valueOf(e.getMessage())))
                        .build();
            }
            result.setProcessingTimeMs(System.currentTimeMillis() - campaignStart);
            metricsService.recordCampaignResult(result.getStatus().name());
            results.add(result);
        }

        ProcessingOutcome outcome = ProcessingOutcome.builder()
                .messageId(event.getMessageId())
                .topic(event.getTopic())
                .shopDomain(shopDomain)
                .status(ProcessingStatus.PROCESSED)
                .variantId(snapshot.getVariantId())
                .productId(snapshot.getProductId())
                .campaignResults(results)
                .build();

        logger.info("Event {} on variant {}: {} campaigns, {} updated, {} failed, {} skipped",
                event.getMessageId(), snapshot.getVariantId(), outcome.getProcessedCount(),
                outcome.getUpdatedCount(), outcome.getFailedCount(), outcome.getSkippedCount());
        return outcome;
    }

    private CampaignResult processCampaign(InventoryChangeEvent event, Campaign campaign, VariantSnapshot snapshot) {
        String campaignId = campaign.getCampaignId();
        CampaignResult.CampaignResultBuilder result = CampaignResult.builder()
                .campaignId(campaignId)
                .campaignName(campaign.getName());

        if (cooldownTracker.isCampaignCoolingDown(campaignId)) {
            return result.status(CampaignResult.Status.SKIPPED_COOLDOWN).reason("campaign cooldown active").build();
        }

        if (!targetMatcher.matches(campaign, snapshot)) {
            return result.status(CampaignResult.Status.NOT_TARGETED).build();
        }

        List<RuleMatch> applicable = new ArrayList<>();
        for (PricingRule rule : campaign.getRules()) {
            RuleEvaluation evaluation = ruleEvaluator.evaluate(rule, campaign, snapshot);
            if (evaluation.isDegraded()) {
                metricsService.recordDegradedEvaluation(evaluation.getError().getOperation());
            }
            if (evaluation.shouldExecute()) {
                applicable.add(new RuleMatch(rule, evaluation));
            }
        }
        if (applicable.isEmpty()) {
            return result.status(CampaignResult.Status.NO_APPLICABLE_RULE).build();
        }

        RuleMatch winner = RulePrioritizer.selectWinner(applicable);
        PricingRule rule = winner.getRule();
        BigDecimal oldPrice = snapshot.getPrice();
        BigDecimal oldCompareAt = snapshot.getCompareAtPrice();
        BigDecimal newPrice = PriceCalculator.computePrice(oldPrice, rule);
        BigDecimal newCompareAt = PriceCalculator.computeCompareAt(oldCompareAt, oldPrice, rule);

        result.ruleId(rule.getRuleId())
                .reason(winner.getReason())
                .degraded(winner.getEvaluation().isDegraded())
                .oldPrice(oldPrice)
                .newPrice(newPrice)
                .oldCompareAtPrice(oldCompareAt)
                .newCompareAtPrice(newCompareAt);

        PriceUpdateResult update;
        try {
            update = priceUpdateGateway.updateVariantPrice(
                    event.getShopDomain(), snapshot.getProductId(), snapshot.getVariantId(), newPrice, newCompareAt);
        } catch (RuntimeException e) {
            logger.error("Price update call failed for variant {} (campaign {})", snapshot.getVariantId(), campaignId, e);
            update = PriceUpdateResult.failure(String.valueOf(e.getMessage()));
        }

        if (!update.isSuccess()) {
            logger.warn("Price update rejected for variant {} (campaign {}): {}",
                    snapshot.getVariantId(), campaignId, update.getErrors());
            metricsService.recordPriceUpdateFailure(event.getShopDomain());
            return result.status(CampaignResult.Status.FAILED).errors(new ArrayList<>(update.getErrors())).build();
        }

        logger.info("Variant {} repriced {} -> {} by campaign {} rule {}",
                snapshot.getVariantId(), oldPrice, newPrice, campaignId, rule.getRuleId());
        metricsService.recordPriceUpdate(event.getShopDomain());

        // Later campaigns in this event see the price that is now live
        snapshot.setPrice(newPrice);
        if (newCompareAt != null) {
            snapshot.setCompareAtPrice(newCompareAt);
        }

        recordAudit(event, campaign, rule, snapshot, winner.getReason(), oldPrice, newPrice, oldCompareAt, newCompareAt);
        afterSuccessfulUpdate(event, campaign, rule, snapshot, winner.getReason(), oldPrice, newPrice, newCompareAt);

        return result.status(CampaignResult.Status.UPDATED).build();
    }

    private void recordAudit(InventoryChangeEvent event, Campaign campaign, PricingRule rule, VariantSnapshot snapshot,
                             String reason, BigDecimal oldPrice, BigDecimal newPrice,
                             BigDecimal oldCompareAt, BigDecimal newCompareAt) {
        try {
            auditRecorder.recordPriceChange(PriceChangeRecord.builder()
                    .shopDomain(event.getShopDomain())
                    .variantId(snapshot.getVariantId())
                    .productId(snapshot.getProductId())
                    .campaignId(campaign.getCampaignId())
                    .campaignName(campaign.getName())
                    .ruleId(rule.getRuleId())
                    .oldPrice(oldPrice)
                    .newPrice(newPrice)
                    .oldCompareAt(newCompareAt != null ? oldCompareAt : null)
                    .newCompareAt(newCompareAt)
                    .reason(reason)
                    .sourceMessageId(event.getMessageId())
                    .build());
        } catch (Exception e) {
            // Price is already live
            logger.error("Failed to record audit for variant {} (campaign {})",
                    snapshot.getVariantId(), campaign.getCampaignId(), e);
            metricsService.recordError("AUDIT_RECORD_ERROR", "recordAudit");
        }
    }

    private void afterSuccessfulUpdate(InventoryChangeEvent event, Campaign campaign, PricingRule rule,
                                       VariantSnapshot snapshot, String reason,
                                       BigDecimal oldPrice, BigDecimal newPrice, BigDecimal newCompareAt) {
        String campaignId = campaign.getCampaignId();
        Instant now = clock.instant();

        try {
            cooldownTracker.setVariantCooldown(snapshot.getVariantId(), campaignId);
        } catch (Exception e) {
            logger.error("Failed to refresh cooldown for variant {}", snapshot.getVariantId(), e);
        }

        try {
            campaignRepository.incrementTriggerCount(campaignId, now);
        } catch (Exception e) {
            logger.error("Failed to increment trigger count for campaign {}", campaignId, e);
        }

        try {
            cooldownTracker.setCampaignCooldown(campaignId);
        } catch (Exception e) {
            logger.error("Failed to set cooldown for campaign {}", campaignId, e);
        }

        priceChangePublisher.publish(new PriceChangeEvent(
                event.getShopDomain(),
                snapshot.getVariantId(),
                snapshot.getProductId(),
                campaignId,
                rule.getRuleId(),
                oldPrice,
                newPrice,
                newCompareAt,
                reason,
                event.getMessageId(),
                now
        ));
    }

    private void rollbackVariantCooldown(String variantId) {
        try {
            cooldownTracker.clearVariantCooldown(variantId);
            logger.debug("Rolled back pre-emptive cooldown for variant {}", variantId);
        } catch (Exception e) {
            logger.error("Failed to roll back cooldown for variant {}, it will expire on its own", variantId, e);
        }
    }

    private void maybeCleanup() {
        double probability = engineProperties.getCleanupProbability();
        if (probability <= 0 || ThreadLocalRandom.current().nextDouble() >= probability) {
            return;
        }
        try {
            metricsService.recordCleanup("lock", lockManager.purgeExpired());
            metricsService.recordCleanup("cooldown", cooldownTracker.purgeExpired());
        } catch (Exception e) {
            logger.warn("Opportunistic cleanup of expired locks/cooldowns failed", e);
        }
    }

    private ProcessingOutcome shortCircuit(InventoryChangeEvent event, ProcessingStatus status,
                                           String variantId, String message) {
        return ProcessingOutcome.builder()
                .messageId(event.getMessageId())
                .topic(event.getTopic())
                .shopDomain(event.getShopDomain())
                .status(status)
                .variantId(variantId)
                .message(message)
                .build();
    }

    private static void validate(InventoryChangeEvent event) {
        if (event == null) {
            throw new InvalidEventException("event", "Event is required");
        }
        if (isBlank(event.getMessageId())) {
            throw new InvalidEventException("messageId", "Event message id is required");
        }
        if (isBlank(event.getTopic())) {
            throw new InvalidEventException("topic", "Event topic is required");
        }
        if (isBlank(event.getShopDomain())) {
            throw new InvalidEventException("shopDomain", "Event shop domain is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
