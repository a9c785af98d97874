package com.cred.freestyle.repricer.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for replaying a webhook through the engine.
 *
 * @author Repricer Team
 */
public class EventSubmissionRequest {

    @NotBlank(message = "Message ID is required")
    private String messageId;

    @NotBlank(message = "Topic is required")
    private String topic;

    @NotBlank(message = "Shop domain is required")
    private String shopDomain;

    @NotNull(message = "Payload is required")
    private JsonNode payload;

    public EventSubmissionRequest() {
    }

    public EventSubmissionRequest(String messageId, String topic, String shopDomain, JsonNode payload) {
        this.messageId = messageId;
        this.topic = topic;
        this.shopDomain = shopDomain;
        this.payload = payload;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public String getShopDomain() {
        return shopDomain;
    }

    public void setShopDomain(String shopDomain) {
        this.shopDomain = shopDomain;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public void setPayload(JsonNode payload) {
        this.payload = payload;
    }
}
