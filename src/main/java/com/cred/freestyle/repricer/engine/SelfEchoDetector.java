package com.cred.freestyle.repricer.engine;

import com.cred.freestyle.repricer.config.EngineProperties;
import com.cred.freestyle.repricer.engine.cooldown.CooldownTracker;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Recognizes product webhooks caused by the engine's own price writes.
 *
 * A product payload is an echo when any of its variants is under a PRICE_UPDATE cooldown, or was
 * modified within the echo window of now. Inventory topics carry no variant timestamps and are never
 * treated as echoes here; the variant cooldown check later in processing covers them.
 *
 * @author Repricer Team
 */
@Component
public class SelfEchoDetector {

    private static final Logger logger = LoggerFactory.getLogger(SelfEchoDetector.class);

    private final CooldownTracker cooldownTracker;
    private final Clock clock;
    private final Duration echoWindow;

    public SelfEchoDetector(CooldownTracker cooldownTracker, Clock clock, EngineProperties engineProperties) {
        this.cooldownTracker = cooldownTracker;
        this.clock = clock;
        this.echoWindow = engineProperties.getEchoWindow();
    }

    /**
     * @return Why the event is an echo, empty if it is not
     */
    public Optional<String> detect(InventoryChangeEvent event) {
        if (!VariantChangeExtractor.isProductTopic(event.getTopic()) || event.getPayload() == null) {
            return Optional.empty();
        }

        JsonNode variants = event.getPayload().path("variants");
        if (!variants.isArray()) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        for (JsonNode variant : variants) {
            String variantId = variant.path("admin_graphql_api_id").asText(null);
            if (variantId == null || variantId.isBlank()) {
                variantId = ShopifyIds.toGid(ShopifyIds.PRODUCT_VARIANT, variant.path("id").asText(null));
            }

            if (variantId != null && cooldownTracker.isVariantCoolingDown(variantId)) {
                return Optional.of("variant " + variantId + " is under price update cooldown");
            }

            Instant updatedAt = parseTimestamp(variant.path("updated_at").asText(null));
            if (updatedAt != null && Duration.between(updatedAt, now).abs().compareTo(echoWindow) < 0) {
                return Optional.of("variant " + variantId + " was updated at " + updatedAt
                        + ", within " + echoWindow.getSeconds() + "s");
            }
        }
        return Optional.empty();
    }

    private static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            logger.debug("Unparsable variant updated_at: {}", value);
            return null;
        }
    }
}
