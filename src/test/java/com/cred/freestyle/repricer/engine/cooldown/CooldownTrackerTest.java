package com.cred.freestyle.repricer.engine.cooldown;

import com.cred.freestyle.repricer.config.EngineProperties;
import com.cred.freestyle.repricer.domain.model.PriceCooldown;
import com.cred.freestyle.repricer.domain.model.PriceCooldown.CooldownType;
import com.cred.freestyle.repricer.testutil.InMemoryCooldownStore;
import com.cred.freestyle.repricer.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for CooldownTracker over an in-memory store.
 */
@DisplayName("CooldownTracker Tests")
class CooldownTrackerTest {

    private static final String VARIANT = "gid://shopify/ProductVariant/1001";

    private InMemoryCooldownStore cooldownStore;
    private MutableClock clock;
    private CooldownTracker cooldownTracker;

    @BeforeEach
    void setUp() {
        cooldownStore = new InMemoryCooldownStore();
        clock = MutableClock.at("2024-01-01T12:00:00Z");
        EngineProperties properties = EngineProperties.builder()
                .variantCooldownTtl(Duration.ofMinutes(2))
                .campaignCooldownTtl(Duration.ofMinutes(1))
                .build();
        cooldownTracker = new CooldownTracker(cooldownStore, clock, properties);
    }

    @Test
    @DisplayName("Variant cooldown - Active until its expiry, then lazily absent")
    void variantCooldown_LazyExpiry() {
        // Given
        Instant expiresAt = cooldownTracker.setVariantCooldown(VARIANT, null);

        // Then
        assertThat(expiresAt).isEqualTo(Instant.parse("2024-01-01T12:02:00Z"));
        assertThat(cooldownTracker.isVariantCoolingDown(VARIANT)).isTrue();

        clock.advance(Duration.ofSeconds(119));
        assertThat(cooldownTracker.isVariantCoolingDown(VARIANT)).isTrue();

        clock.advance(Duration.ofSeconds(1));
        assertThat(cooldownTracker.isVariantCoolingDown(VARIANT)).isFalse();
        assertThat(cooldownStore.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("set - Setting again moves the expiry and records the campaign")
    void set_Upsert_ExtendsExpiry() {
        // Given
        cooldownTracker.setVariantCooldown(VARIANT, null);
        clock.advance(Duration.ofSeconds(90));

        // When
        cooldownTracker.setVariantCooldown(VARIANT, "camp-1");

        // Then
        PriceCooldown record = cooldownStore.get(VARIANT, CooldownType.PRICE_UPDATE);
        assertThat(record.getExpiresAt()).isEqualTo(Instant.parse("2024-01-01T12:03:30Z"));
        assertThat(record.getCampaignId()).isEqualTo("camp-1");
        assertThat(cooldownStore.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Campaign cooldown - Stored under the campaign_ key and independent of variant cooldowns")
    void campaignCooldown_SeparateKeySpace() {
        // When
        cooldownTracker.setCampaignCooldown("camp-1");

        // Then
        assertThat(cooldownStore.get("campaign_camp-1", CooldownType.CAMPAIGN_TRIGGER)).isNotNull();
        assertThat(cooldownTracker.isCampaignCoolingDown("camp-1")).isTrue();
        assertThat(cooldownTracker.isCampaignCoolingDown("camp-2")).isFalse();
        assertThat(cooldownTracker.isSuppressed("campaign_camp-1", CooldownType.PRICE_UPDATE)).isFalse();
    }

    @Test
    @DisplayName("clear - Removes the cooldown and reports whether one existed")
    void clear_RemovesCooldown() {
        // Given
        cooldownTracker.setVariantCooldown(VARIANT, null);

        // When / Then
        assertThat(cooldownTracker.clearVariantCooldown(VARIANT)).isTrue();
        assertThat(cooldownTracker.isVariantCoolingDown(VARIANT)).isFalse();
        assertThat(cooldownTracker.clearVariantCooldown(VARIANT)).isFalse();
    }

    @Test
    @DisplayName("isSuppressed - Store failure reads as not suppressed")
    void isSuppressed_StoreFailure_False() {
        // Given
        cooldownTracker.setVariantCooldown(VARIANT, null);
        cooldownStore.setFailing(true);

        // When / Then
        assertThat(cooldownTracker.isVariantCoolingDown(VARIANT)).isFalse();
    }

    @Test
    @DisplayName("listActive and purgeExpired - Only unexpired records survive")
    void listActiveAndPurge() {
        // Given
        cooldownTracker.setCampaignCooldown("camp-1");
        cooldownTracker.setVariantCooldown(VARIANT, "camp-1");
        clock.advance(Duration.ofSeconds(90));

        // When
        List<PriceCooldown> active = cooldownTracker.listActive();
        int purged = cooldownTracker.purgeExpired();

        // Then
        assertThat(active).extracting(PriceCooldown::getCooldownKey).containsExactly(VARIANT);
        assertThat(purged).isEqualTo(1);
        assertThat(cooldownStore.size()).isEqualTo(1);
    }
}
