package com.cred.freestyle.repricer.engine;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Normalized inbound webhook: what the platform sent, for which shop, under which delivery id.
 * Delivery is at-least-once, so the same {@code messageId} can arrive more than once.
 *
 * @author Repricer Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryChangeEvent {

    /**
     * Unique delivery identifier (webhook id or broker message id).
     */
    private String messageId;

    /**
     * Webhook topic, e.g. "inventory_levels/update".
     */
    private String topic;

    private String shopDomain;

    /**
     * Raw webhook body.
     */
    private JsonNode payload;

    @Builder.Default
    private Map<String, String> attributes = new HashMap<>();

    private Instant receivedAt;
}
