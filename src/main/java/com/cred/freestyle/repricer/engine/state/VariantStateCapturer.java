package com.cred.freestyle.repricer.engine.state;

import com.cred.freestyle.repricer.domain.model.VariantStateHistory;
import com.cred.freestyle.repricer.engine.VariantChange;
import com.cred.freestyle.repricer.gateway.VariantQueryGateway;
import com.cred.freestyle.repricer.gateway.VariantSnapshot;
import com.cred.freestyle.repricer.repository.VariantStateHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Captures the state of a variant at evaluation time.
 *
 * The variant is read from the platform (unless the event extraction already did so) and the
 * inventory reported by the webhook, when present, overrides the queried value. A history row is
 * appended whenever inventory or price differ from the last recorded snapshot; history is
 * best-effort and never blocks evaluation.
 *
 * @author Repricer Team
 */
@Service
public class VariantStateCapturer {

    private static final Logger logger = LoggerFactory.getLogger(VariantStateCapturer.class);

    private final VariantQueryGateway variantQueryGateway;
    private final VariantStateHistoryRepository historyRepository;
    private final Clock clock;

    public VariantStateCapturer(
            VariantQueryGateway variantQueryGateway,
            VariantStateHistoryRepository historyRepository,
            Clock clock
    ) {
        this.variantQueryGateway = variantQueryGateway;
        this.historyRepository = historyRepository;
        this.clock = clock;
    }

    /**
     * Capture the current state of the changed variant.
     *
     * @param shopDomain Shop of the variant
     * @param change Variant change extracted from the event
     * @return Snapshot, empty if the variant cannot be found
     */
    public Optional<VariantSnapshot> capture(String shopDomain, VariantChange change) {
        VariantSnapshot snapshot = change.getPrefetched();
        if (snapshot == null) {
            snapshot = variantQueryGateway.getVariant(shopDomain, change.getVariantId()).orElse(null);
        }
        if (snapshot == null) {
            return Optional.empty();
        }

        if (change.getReportedInventory() != null) {
            snapshot = snapshot.withInventoryQuantity(change.getReportedInventory());
        }
        if (snapshot.getProductId() == null && change.getProductId() != null) {
            snapshot.setProductId(change.getProductId());
        }
        Instant now = clock.instant();
        snapshot.setCapturedAt(now);

        recordHistory(shopDomain, snapshot, now);
        return Optional.of(snapshot);
    }

    private void recordHistory(String shopDomain, VariantSnapshot snapshot, Instant now) {
        try {
            VariantStateHistory previous = historyRepository
                    .findFirstByVariantIdOrderByCapturedAtDesc(snapshot.getVariantId())
                    .orElse(null);

            Integer inventoryChange = null;
            BigDecimal priceChange = null;
            if (previous != null) {
                boolean inventoryChanged = previous.getInventoryQuantity() != snapshot.getInventoryQuantity();
                boolean priceChanged = !samePrice(previous.getPrice(), snapshot.getPrice());
                if (!inventoryChanged && !priceChanged) {
                    return;
                }
                inventoryChange = snapshot.getInventoryQuantity() - previous.getInventoryQuantity();
                if (previous.getPrice() != null && snapshot.getPrice() != null) {
                    priceChange = snapshot.getPrice().subtract(previous.getPrice());
                }
            }

            historyRepository.save(VariantStateHistory.builder()
                    .variantId(snapshot.getVariantId())
                    .productId(snapshot.getProductId())
                    .shopDomain(shopDomain)
                    .inventoryQuantity(snapshot.getInventoryQuantity())
                    .price(snapshot.getPrice())
                    .compareAtPrice(snapshot.getCompareAtPrice())
                    .inventoryChange(inventoryChange)
                    .priceChange(priceChange)
                    .changeReason(previous == null ? "initial_capture" : "webhook_observation")
                    .capturedAt(now)
                    .build());
        } catch (Exception e) {
            logger.warn("Failed to record state history for variant {}", snapshot.getVariantId(), e);
        }
    }

    private static boolean samePrice(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return Objects.equals(a, b);
        }
        return a.compareTo(b) == 0;
    }
}
