package com.cred.freestyle.repricer.engine;

import com.cred.freestyle.repricer.gateway.VariantQueryGateway;
import com.cred.freestyle.repricer.gateway.VariantSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Topic-specific extraction of the affected variant from a webhook payload.
 *
 * Supported topics:
 * - inventory_levels/update: {@code inventory_item_id} resolved to its variant, {@code available} as inventory
 * - inventory_items/update: {@code id} resolved to its variant
 * - products/update, products/create: first entry of {@code variants}
 *
 * @author Repricer Team
 */
@Component
public class VariantChangeExtractor {

    private static final Logger logger = LoggerFactory.getLogger(VariantChangeExtractor.class);

    public static final String INVENTORY_LEVELS_UPDATE = "inventory_levels/update";
    public static final String INVENTORY_ITEMS_UPDATE = "inventory_items/update";
    public static final String PRODUCTS_UPDATE = "products/update";
    public static final String PRODUCTS_CREATE = "products/create";

    private static final Set<String> SUPPORTED_TOPICS = Set.of(
            INVENTORY_LEVELS_UPDATE, INVENTORY_ITEMS_UPDATE, PRODUCTS_UPDATE, PRODUCTS_CREATE);

    private final VariantQueryGateway variantQueryGateway;

    public VariantChangeExtractor(VariantQueryGateway variantQueryGateway) {
        this.variantQueryGateway = variantQueryGateway;
    }

    public boolean supports(String topic) {
        return topic != null && SUPPORTED_TOPICS.contains(topic);
    }

    public static boolean isProductTopic(String topic) {
        return PRODUCTS_UPDATE.equals(topic) || PRODUCTS_CREATE.equals(topic);
    }

    /**
     * Extract the changed variant.
     *
     * @param event Inbound event with a supported topic
     * @return The variant change, empty when the payload does not identify a usable variant
     */
    public Optional<VariantChange> extract(InventoryChangeEvent event) {
        JsonNode payload = event.getPayload();
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            logger.warn("Event {} ({}) has no payload", event.getMessageId(), event.getTopic());
            return Optional.empty();
        }

        switch (event.getTopic()) {
            case INVENTORY_LEVELS_UPDATE:
                return fromInventoryItem(event, text(payload, "inventory_item_id"), integer(payload, "available"));
            case INVENTORY_ITEMS_UPDATE:
                return fromInventoryItem(event, text(payload, "id"), null);
            case PRODUCTS_UPDATE:
            case PRODUCTS_CREATE:
                return fromProduct(event, payload);
            default:
                return Optional.empty();
        }
    }

    private Optional<VariantChange> fromInventoryItem(InventoryChangeEvent event, String inventoryItemId,
                                                      Integer reportedInventory) {
        if (inventoryItemId == null) {
            logger.warn("Event {} ({}) carries no inventory item id", event.getMessageId(), event.getTopic());
            return Optional.empty();
        }

        Optional<VariantSnapshot> variant =
                variantQueryGateway.getVariantByInventoryItem(event.getShopDomain(), inventoryItemId);
        if (variant.isEmpty()) {
            logger.warn("No variant found for inventory item {} (event {})", inventoryItemId, event.getMessageId());
            return Optional.empty();
        }

        VariantSnapshot snapshot = variant.get();
        return Optional.of(VariantChange.builder()
                .variantId(snapshot.getVariantId())
                .productId(snapshot.getProductId())
                .inventoryItemId(inventoryItemId)
                .reportedInventory(reportedInventory)
                .prefetched(snapshot)
                .build());
    }

    private Optional<VariantChange> fromProduct(InventoryChangeEvent event, JsonNode payload) {
        JsonNode variants = payload.path("variants");
        if (!variants.isArray() || variants.isEmpty()) {
            logger.warn("Product event {} has no variants", event.getMessageId());
            return Optional.empty();
        }

        JsonNode first = variants.get(0);
        String variantId = text(first, "admin_graphql_api_id");
        if (variantId == null) {
            variantId = ShopifyIds.toGid(ShopifyIds.PRODUCT_VARIANT, text(first, "id"));
        }
        String productId = text(payload, "admin_graphql_api_id");
        if (productId == null) {
            productId = ShopifyIds.toGid(ShopifyIds.PRODUCT, text(payload, "id"));
        }
        if (variantId == null) {
            logger.warn("Product event {} has a variant without id", event.getMessageId());
            return Optional.empty();
        }

        return Optional.of(VariantChange.builder()
                .variantId(variantId)
                .productId(productId)
                .inventoryItemId(text(first, "inventory_item_id"))
                .reportedInventory(integer(first, "inventory_quantity"))
                .build());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isNumber()) {
            return value.intValue();
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
