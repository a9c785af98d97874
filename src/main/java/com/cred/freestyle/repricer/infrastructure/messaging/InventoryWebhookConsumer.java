package com.cred.freestyle.repricer.infrastructure.messaging;

import com.cred.freestyle.repricer.engine.EventProcessor;
import com.cred.freestyle.repricer.engine.InventoryChangeEvent;
import com.cred.freestyle.repricer.engine.ProcessingOutcome;
import com.cred.freestyle.repricer.exception.EventProcessingException;
import com.cred.freestyle.repricer.exception.InvalidEventException;
import com.cred.freestyle.repricer.infrastructure.metrics.RepricerMetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Kafka consumer for platform webhooks relayed by the webhook-delivery service.
 *
 * Acknowledgment policy:
 * - processed, short-circuited, unparsable or invalid messages are acknowledged
 * - an {@link EventProcessingException} is not acknowledged and is rethrown, so the container's
 *   error handling redelivers the message; the engine itself never retries
 *
 * @author Repricer Team
 */
@Service
public class InventoryWebhookConsumer {

    private static final Logger logger = LoggerFactory.getLogger(InventoryWebhookConsumer.class);

    private final EventProcessor eventProcessor;
    private final RepricerMetricsService metricsService;
    private final ObjectMapper objectMapper;

    public InventoryWebhookConsumer(
            EventProcessor eventProcessor,
            RepricerMetricsService metricsService,
            ObjectMapper objectMapper
    ) {
        this.eventProcessor = eventProcessor;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
    }

    /**
     * Kafka listener for webhook messages.
     *
     * @param record Consumer record; key is the shop domain, value the JSON event
     * @param acknowledgment Manual acknowledgment
     */
    @KafkaListener(
            topics = "${repricer.kafka.webhook-topic:shopify-webhooks}",
            groupId = "${spring.kafka.consumer.group-id:inventory-repricer}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        InventoryChangeEvent event;
        try {
            event = objectMapper.readValue(record.value(), InventoryChangeEvent.class);
        } catch (JsonProcessingException e) {
            logger.error("Unparsable webhook message at partition {} offset {}, skipping",
                    record.partition(), record.offset(), e);
            metricsService.recordError("MESSAGE_PARSE_ERROR", "consume");
            acknowledge(acknowledgment);
            return;
        }

        if (event.getMessageId() == null || event.getMessageId().isBlank()) {
            // Fall back to the broker position as a stable delivery id
            event.setMessageId(record.topic() + "-" + record.partition() + "-" + record.offset());
        }
        if (event.getShopDomain() == null && record.key() != null) {
            event.setShopDomain(record.key());
        }
        if (event.getReceivedAt() == null) {
            event.setReceivedAt(Instant.now());
        }

        try {
            ProcessingOutcome outcome = eventProcessor.process(event);
            logger.info("Webhook {} ({}) -> {}: {} updated, {} failed, {} skipped",
                    event.getMessageId(), event.getTopic(), outcome.getStatus(),
                    outcome.getUpdatedCount(), outcome.getFailedCount(), outcome.getSkippedCount());
            acknowledge(acknowledgment);
        } catch (InvalidEventException e) {
            logger.warn("Invalid webhook message {}: {}", event.getMessageId(), e.getMessage());
            acknowledge(acknowledgment);
        } catch (EventProcessingException e) {
            logger.error("Fatal error processing webhook {}, leaving unacknowledged", event.getMessageId(), e);
            throw e;
        }
    }

    private static void acknowledge(Acknowledgment acknowledgment) {
        if (acknowledgment != null) {
            acknowledgment.acknowledge();
        }
    }
}
