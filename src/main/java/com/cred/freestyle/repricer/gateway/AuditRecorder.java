package com.cred.freestyle.repricer.gateway;

/**
 * Write-only sink for the audit trail of applied price changes.
 *
 * @author Repricer Team
 */
public interface AuditRecorder {

    void recordPriceChange(PriceChangeRecord record);
}
