package com.cred.freestyle.repricer.gateway.shopify;

import com.cred.freestyle.repricer.engine.ShopifyIds;
import com.cred.freestyle.repricer.exception.ShopifyApiException;
import com.cred.freestyle.repricer.gateway.PriceUpdateGateway;
import com.cred.freestyle.repricer.gateway.PriceUpdateResult;
import com.cred.freestyle.repricer.gateway.VariantQueryGateway;
import com.cred.freestyle.repricer.gateway.VariantSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Shopify Admin GraphQL client: variant lookups for evaluation and the price mutation.
 *
 * Query methods return empty when the variant cannot be read; the mutation reports failures
 * through {@link PriceUpdateResult}. Neither lets transport errors escape.
 *
 * @author Repricer Team
 */
@Component
public class ShopifyAdminClient implements VariantQueryGateway, PriceUpdateGateway {

    private static final Logger logger = LoggerFactory.getLogger(ShopifyAdminClient.class);

    static final String ACCESS_TOKEN_HEADER = "X-Shopify-Access-Token";
    private static final String GRAPHQL_URL = "https://{shop}/admin/api/{version}/graphql.json";

    private static final String VARIANT_FIELDS =
            "id price compareAtPrice inventoryQuantity " +
            "inventoryItem { id tracked } " +
            "product { id vendor productType tags collections(first: 50) { nodes { id } } }";

    static final String VARIANT_QUERY =
            "query getVariantDetails($id: ID!) { productVariant(id: $id) { " + VARIANT_FIELDS + " } }";

    static final String INVENTORY_ITEM_QUERY =
            "query getVariantByInventoryItem($id: ID!) { inventoryItem(id: $id) { variant { " + VARIANT_FIELDS + " } } }";

    static final String PRICE_MUTATION =
            "mutation updateVariantPrice($productId: ID!, $variants: [ProductVariantsBulkInput!]!) { " +
            "productVariantsBulkUpdate(productId: $productId, variants: $variants) { " +
            "productVariants { id price compareAtPrice } userErrors { field message } } }";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiVersion;
    private final String accessToken;

    public ShopifyAdminClient(
            @Qualifier("shopifyRestClient") RestClient restClient,
            ObjectMapper objectMapper,
            @Value("${repricer.shopify.api-version:2024-07}") String apiVersion,
            @Value("${repricer.shopify.access-token:}") String accessToken
    ) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.apiVersion = apiVersion;
        this.accessToken = accessToken;
    }

    @Override
    public Optional<VariantSnapshot> getVariant(String shopDomain, String variantId) {
        ObjectNode variables = objectMapper.createObjectNode();
        variables.put("id", ShopifyIds.toGid(ShopifyIds.PRODUCT_VARIANT, variantId));
        try {
            JsonNode data = execute(shopDomain, "getVariant", VARIANT_QUERY, variables);
            return toSnapshot(data.path("productVariant"));
        } catch (ShopifyApiException e) {
            logger.error("Failed to load variant {} from {}: {}", variantId, shopDomain, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<VariantSnapshot> getVariantByInventoryItem(String shopDomain, String inventoryItemId) {
        ObjectNode variables = objectMapper.createObjectNode();
        variables.put("id", ShopifyIds.toGid(ShopifyIds.INVENTORY_ITEM, inventoryItemId));
        try {
            JsonNode data = execute(shopDomain, "getVariantByInventoryItem", INVENTORY_ITEM_QUERY, variables);
            return toSnapshot(data.path("inventoryItem").path("variant"));
        } catch (ShopifyApiException e) {
            logger.error("Failed to resolve inventory item {} on {}: {}", inventoryItemId, shopDomain, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public PriceUpdateResult updateVariantPrice(String shopDomain, String productId, String variantId,
                                                BigDecimal newPrice, BigDecimal newCompareAtPrice) {
        ObjectNode variables = objectMapper.createObjectNode();
        variables.put("productId", ShopifyIds.toGid(ShopifyIds.PRODUCT, productId));
        ArrayNode variants = variables.putArray("variants");
        ObjectNode variant = variants.addObject();
        variant.put("id", ShopifyIds.toGid(ShopifyIds.PRODUCT_VARIANT, variantId));
        variant.put("price", newPrice.toPlainString());
        if (newCompareAtPrice != null) {
            variant.put("compareAtPrice", newCompareAtPrice.toPlainString());
        }

        JsonNode data;
        try {
            data = execute(shopDomain, "updateVariantPrice", PRICE_MUTATION, variables);
        } catch (ShopifyApiException e) {
            logger.error("Price mutation for variant {} on {} failed: {}", variantId, shopDomain, e.getMessage());
            return PriceUpdateResult.failure(e.getMessage());
        }

        JsonNode payload = data.path("productVariantsBulkUpdate");
        JsonNode userErrors = payload.path("userErrors");
        if (userErrors.isArray() && userErrors.size() > 0) {
            List<String> errors = new ArrayList<>();
            for (JsonNode error : userErrors) {
                errors.add(error.path("message").asText("unknown error"));
            }
            return PriceUpdateResult.failure(errors);
        }

        JsonNode updated = payload.path("productVariants").path(0);
        if (updated.isMissingNode()) {
            return PriceUpdateResult.success(variantId, newPrice, newCompareAtPrice);
        }
        return PriceUpdateResult.success(
                updated.path("id").asText(variantId),
                decimal(updated.path("price"), newPrice),
                decimal(updated.path("compareAtPrice"), newCompareAtPrice)
        );
    }

    /**
     * POST one GraphQL document and return its "data" object.
     *
     * @throws ShopifyApiException on transport errors, non-2xx responses or top-level GraphQL errors
     */
    private JsonNode execute(String shopDomain, String operation, String query, ObjectNode variables) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("query", query);
        request.set("variables", variables);

        String body;
        try {
            body = restClient.post()
                    .uri(GRAPHQL_URL, shopDomain, apiVersion)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .header(ACCESS_TOKEN_HEADER, accessToken)
                    .body(objectMapper.writeValueAsString(request))
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException | JsonProcessingException e) {
            throw new ShopifyApiException(shopDomain, operation, e);
        }

        JsonNode response;
        try {
            response = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new ShopifyApiException(shopDomain, operation, e);
        }
        if (response == null || response.isMissingNode()) {
            throw new ShopifyApiException(shopDomain, operation, "empty response");
        }

        JsonNode errors = response.path("errors");
        if (errors.isArray() && errors.size() > 0) {
            throw new ShopifyApiException(shopDomain, operation, errors.path(0).path("message").asText(errors.toString()));
        }
        return response.path("data");
    }

    private Optional<VariantSnapshot> toSnapshot(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Optional.empty();
        }
        JsonNode product = node.path("product");
        JsonNode inventoryItem = node.path("inventoryItem");

        Set<String> tags = new HashSet<>();
        for (JsonNode tag : product.path("tags")) {
            tags.add(tag.asText());
        }
        Set<String> collectionIds = new HashSet<>();
        for (JsonNode collection : product.path("collections").path("nodes")) {
            collectionIds.add(collection.path("id").asText());
        }

        return Optional.of(VariantSnapshot.builder()
                .variantId(node.path("id").asText())
                .productId(textOrNull(product.path("id")))
                .inventoryItemId(textOrNull(inventoryItem.path("id")))
                .price(decimal(node.path("price"), BigDecimal.ZERO))
                .compareAtPrice(decimal(node.path("compareAtPrice"), null))
                .inventoryQuantity(node.path("inventoryQuantity").asInt(0))
                .inventoryTracked(inventoryItem.path("tracked").asBoolean(true))
                .vendor(textOrNull(product.path("vendor")))
                .productType(textOrNull(product.path("productType")))
                .tags(tags)
                .collectionIds(collectionIds)
                .build());
    }

    private static BigDecimal decimal(JsonNode node, BigDecimal fallback) {
        if (node == null || node.isMissingNode() || node.isNull() || node.asText().isBlank()) {
            return fallback;
        }
        try {
            return new BigDecimal(node.asText());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
