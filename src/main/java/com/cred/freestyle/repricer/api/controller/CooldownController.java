package com.cred.freestyle.repricer.api.controller;

import com.cred.freestyle.repricer.api.dto.CooldownResponse;
import com.cred.freestyle.repricer.domain.model.PriceCooldown.CooldownType;
import com.cred.freestyle.repricer.engine.cooldown.CooldownTracker;
import com.cred.freestyle.repricer.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Inspect and clear active cooldowns.
 * Keys are passed as query parameters because variant keys are global ids containing slashes.
 *
 * @author Repricer Team
 */
@RestController
@RequestMapping("/api/v1/cooldowns")
public class CooldownController {

    private static final Logger logger = LoggerFactory.getLogger(CooldownController.class);

    private final CooldownTracker cooldownTracker;
    private final Clock clock;

    public CooldownController(CooldownTracker cooldownTracker, Clock clock) {
        this.cooldownTracker = cooldownTracker;
        this.clock = clock;
    }

    /**
     * List unexpired cooldowns, optionally filtered by type.
     */
    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<CooldownResponse>> listCooldowns(
            @RequestParam(value = "type", required = false) String type
    ) {
        CooldownType filter = type != null ? parseType(type) : null;
        Instant now = clock.instant();

        List<CooldownResponse> response = cooldownTracker.listActive().stream()
                .filter(cooldown -> filter == null || cooldown.getCooldownType() == filter)
                .map(cooldown -> CooldownResponse.from(cooldown, now))
                .collect(Collectors.toList());

        return ResponseEntity.ok(response);
    }

    /**
     * Clear one cooldown so the next event for the key is evaluated immediately.
     *
     * @param key Variant id or campaign key
     * @param type PRICE_UPDATE (default) or CAMPAIGN_TRIGGER
     * @return 204 when cleared
     * @throws ResourceNotFoundException if no such cooldown exists
     */
    @DeleteMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> clearCooldown(
            @RequestParam("key") String key,
            @RequestParam(value = "type", defaultValue = "PRICE_UPDATE") String type
    ) {
        CooldownType cooldownType = parseType(type);
        if (!cooldownTracker.clear(key, cooldownType)) {
            throw new ResourceNotFoundException("Cooldown", cooldownType + ":" + key);
        }
        logger.info("Cleared {} cooldown for {}", cooldownType, key);
        return ResponseEntity.noContent().build();
    }

    private static CooldownType parseType(String type) {
        try {
            return CooldownType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown cooldown type: " + type);
        }
    }
}
