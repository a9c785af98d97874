package com.cred.freestyle.repricer.api.controller;

import com.cred.freestyle.repricer.api.dto.EventSubmissionRequest;
import com.cred.freestyle.repricer.engine.EventProcessor;
import com.cred.freestyle.repricer.engine.InventoryChangeEvent;
import com.cred.freestyle.repricer.engine.ProcessingOutcome;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Manual event submission. Runs a webhook through the same pipeline as the Kafka consumer,
 * so duplicate message ids are still suppressed by the message lock.
 *
 * @author Repricer Team
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    static final String SOURCE_ATTRIBUTE = "source";
    static final String SUBMITTED_BY_ATTRIBUTE = "submittedBy";

    private final EventProcessor eventProcessor;
    private final Clock clock;

    public EventController(EventProcessor eventProcessor, Clock clock) {
        this.eventProcessor = eventProcessor;
        this.clock = clock;
    }

    /**
     * Process a webhook payload synchronously.
     *
     * @param request Event envelope
     * @param authentication Calling operator, may be null when filters are bypassed
     * @return Processing outcome with per-campaign results
     */
    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ProcessingOutcome> submitEvent(
            @Valid @RequestBody EventSubmissionRequest request,
            Authentication authentication
    ) {
        Map<String, String> attributes = new HashMap<>();
        attributes.put(SOURCE_ATTRIBUTE, "admin-api");
        if (authentication != null) {
            attributes.put(SUBMITTED_BY_ATTRIBUTE, authentication.getName());
        }

        InventoryChangeEvent event = InventoryChangeEvent.builder()
                .messageId(request.getMessageId())
                .topic(request.getTopic())
                .shopDomain(request.getShopDomain())
                .payload(request.getPayload())
                .attributes(attributes)
                .receivedAt(clock.instant())
                .build();

        logger.info("Manual submission of event {} ({}) for {}",
                request.getMessageId(), request.getTopic(), request.getShopDomain());

        ProcessingOutcome outcome = eventProcessor.process(event);
        return ResponseEntity.ok(outcome);
    }
}
