package com.cred.freestyle.repricer.infrastructure.messaging;

import com.cred.freestyle.repricer.infrastructure.messaging.events.PriceChangeEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes applied price changes for downstream consumers (dashboards, analytics).
 * Publishing is best-effort: the price change has already happened and is audited either way.
 *
 * @author Repricer Team
 */
@Service
public class PriceChangePublisher {

    private static final Logger logger = LoggerFactory.getLogger(PriceChangePublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;

    public PriceChangePublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Value("${repricer.kafka.price-change-topic:repricer-price-changes}") String topic
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
    }

    /**
     * Publish a price change event keyed by variant id.
     *
     * @param event Price change event
     */
    public void publish(PriceChangeEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    topic,
                    event.getVariantId(),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published price change for variant {} (campaign {}), partition: {}",
                            event.getVariantId(), event.getCampaignId(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish price change for variant {} (campaign {})",
                            event.getVariantId(), event.getCampaignId(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing price change event for variant {}", event.getVariantId(), e);
        } catch (Exception e) {
            logger.error("Error sending price change event for variant {}", event.getVariantId(), e);
        }
    }
}
