package com.cred.freestyle.repricer.gateway.audit;

import com.cred.freestyle.repricer.domain.model.AuditTrailEntry;
import com.cred.freestyle.repricer.gateway.AuditRecorder;
import com.cred.freestyle.repricer.gateway.PriceChangeRecord;
import com.cred.freestyle.repricer.repository.AuditTrailEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes applied price changes to the audit trail.
 * One price_update row per change, plus a compare_at_update row when the compare-at price moved.
 *
 * @author Repricer Team
 */
@Component
public class JpaAuditRecorder implements AuditRecorder {

    private static final Logger logger = LoggerFactory.getLogger(JpaAuditRecorder.class);

    private final AuditTrailEntryRepository auditRepository;

    public JpaAuditRecorder(AuditTrailEntryRepository auditRepository) {
        this.auditRepository = auditRepository;
    }

    @Override
    @Transactional
    public void recordPriceChange(PriceChangeRecord record) {
        String triggerReason = triggerReason(record);

        List<AuditTrailEntry> entries = new ArrayList<>();
        entries.add(entry(record, AuditTrailEntry.CHANGE_PRICE, record.getOldPrice(), record.getNewPrice(), triggerReason));

        if (record.getNewCompareAt() != null && !sameAmount(record.getOldCompareAt(), record.getNewCompareAt())) {
            entries.add(entry(record, AuditTrailEntry.CHANGE_COMPARE_AT,
                    record.getOldCompareAt(), record.getNewCompareAt(), triggerReason));
        }

        auditRepository.saveAll(entries);
        logger.debug("Recorded {} audit entries for variant {} (campaign {})",
                entries.size(), record.getVariantId(), record.getCampaignId());
    }

    private static AuditTrailEntry entry(PriceChangeRecord record, String changeType,
                                         BigDecimal oldValue, BigDecimal newValue, String triggerReason) {
        return AuditTrailEntry.builder()
                .entityType(AuditTrailEntry.ENTITY_VARIANT)
                .entityId(record.getVariantId())
                .productId(record.getProductId())
                .changeType(changeType)
                .oldValue(oldValue != null ? oldValue.toPlainString() : null)
                .newValue(newValue != null ? newValue.toPlainString() : null)
                .triggerReason(triggerReason)
                .campaignId(record.getCampaignId())
                .ruleId(record.getRuleId())
                .sourceMessageId(record.getSourceMessageId())
                .shopDomain(record.getShopDomain())
                .build();
    }

    static String triggerReason(PriceChangeRecord record) {
        String name = record.getCampaignName() != null ? record.getCampaignName() : record.getCampaignId();
        if (record.getReason() == null || record.getReason().isBlank()) {
            return "Campaign \"" + name + "\"";
        }
        return "Campaign \"" + name + "\": " + record.getReason();
    }

    private static boolean sameAmount(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }
}
