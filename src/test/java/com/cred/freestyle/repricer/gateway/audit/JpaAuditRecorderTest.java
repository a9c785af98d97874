package com.cred.freestyle.repricer.gateway.audit;

import com.cred.freestyle.repricer.domain.model.AuditTrailEntry;
import com.cred.freestyle.repricer.gateway.PriceChangeRecord;
import com.cred.freestyle.repricer.repository.AuditTrailEntryRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for JpaAuditRecorder.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("JpaAuditRecorder Tests")
class JpaAuditRecorderTest {

    @Mock
    private AuditTrailEntryRepository auditRepository;

    @InjectMocks
    private JpaAuditRecorder auditRecorder;

    private static PriceChangeRecord.PriceChangeRecordBuilder record() {
        return PriceChangeRecord.builder()
                .shopDomain("test-shop.myshopify.com")
                .variantId("gid://shopify/ProductVariant/1001")
                .productId("gid://shopify/Product/2001")
                .campaignId("camp-1")
                .campaignName("Low stock markup")
                .ruleId("rule-1")
                .oldPrice(new BigDecimal("20.00"))
                .newPrice(new BigDecimal("25.00"))
                .reason("Inventory crossed threshold: 15 -> 8 is less_than_abs 10")
                .sourceMessageId("m2");
    }

    @SuppressWarnings("unchecked")
    private List<AuditTrailEntry> savedEntries() {
        ArgumentCaptor<Iterable<AuditTrailEntry>> captor = ArgumentCaptor.forClass(Iterable.class);
        verify(auditRepository).saveAll(captor.capture());
        List<AuditTrailEntry> entries = new ArrayList<>();
        captor.getValue().forEach(entries::add);
        return entries;
    }

    @Test
    @DisplayName("recordPriceChange - Price-only change writes one price_update entry")
    void recordPriceChange_PriceOnly() {
        // When
        auditRecorder.recordPriceChange(record().build());

        // Then
        List<AuditTrailEntry> entries = savedEntries();
        assertThat(entries).hasSize(1);
        AuditTrailEntry entry = entries.get(0);
        assertThat(entry.getChangeType()).isEqualTo(AuditTrailEntry.CHANGE_PRICE);
        assertThat(entry.getEntityType()).isEqualTo(AuditTrailEntry.ENTITY_VARIANT);
        assertThat(entry.getOldValue()).isEqualTo("20.00");
        assertThat(entry.getNewValue()).isEqualTo("25.00");
        assertThat(entry.getTriggerReason())
                .isEqualTo("Campaign \"Low stock markup\": Inventory crossed threshold: 15 -> 8 is less_than_abs 10");
        assertThat(entry.getSourceMessageId()).isEqualTo("m2");
    }

    @Test
    @DisplayName("recordPriceChange - Moved compare-at price adds a compare_at_update entry")
    void recordPriceChange_CompareAtMoved() {
        // When
        auditRecorder.recordPriceChange(record()
                .oldCompareAt(new BigDecimal("30.00"))
                .newCompareAt(new BigDecimal("35.00"))
                .build());

        // Then
        List<AuditTrailEntry> entries = savedEntries();
        assertThat(entries).extracting(AuditTrailEntry::getChangeType)
                .containsExactly(AuditTrailEntry.CHANGE_PRICE, AuditTrailEntry.CHANGE_COMPARE_AT);
        assertThat(entries.get(1).getOldValue()).isEqualTo("30.00");
        assertThat(entries.get(1).getNewValue()).isEqualTo("35.00");
    }

    @Test
    @DisplayName("recordPriceChange - Unchanged compare-at price is not audited")
    void recordPriceChange_CompareAtUnchanged() {
        // When
        auditRecorder.recordPriceChange(record()
                .oldCompareAt(new BigDecimal("30.00"))
                .newCompareAt(new BigDecimal("30.0"))
                .build());

        // Then
        assertThat(savedEntries()).hasSize(1);
    }

    @Test
    @DisplayName("triggerReason - Falls back to the campaign id when the name is missing")
    void triggerReason_NoName() {
        assertThat(JpaAuditRecorder.triggerReason(record().campaignName(null).reason(null).build()))
                .isEqualTo("Campaign \"camp-1\"");
    }
}
