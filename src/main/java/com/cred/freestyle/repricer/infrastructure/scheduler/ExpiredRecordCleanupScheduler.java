package com.cred.freestyle.repricer.infrastructure.scheduler;

import com.cred.freestyle.repricer.engine.cooldown.CooldownTracker;
import com.cred.freestyle.repricer.engine.lock.LockManager;
import com.cred.freestyle.repricer.infrastructure.metrics.RepricerMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically deletes expired lock and cooldown records.
 *
 * Expired records are already ignored by every check, so this only bounds table growth. It
 * complements the opportunistic cleanup the event processor runs on a fraction of events.
 * With the Redis backend keys expire natively and both purges are no-ops.
 *
 * @author Repricer Team
 */
@Service
public class ExpiredRecordCleanupScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ExpiredRecordCleanupScheduler.class);

    private final LockManager lockManager;
    private final CooldownTracker cooldownTracker;
    private final RepricerMetricsService metricsService;

    @Value("${repricer.cleanup.scheduler-enabled:true}")
    private boolean schedulerEnabled;

    public ExpiredRecordCleanupScheduler(
            LockManager lockManager,
            CooldownTracker cooldownTracker,
            RepricerMetricsService metricsService
    ) {
        this.lockManager = lockManager;
        this.cooldownTracker = cooldownTracker;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${repricer.cleanup.interval-ms:60000}")
    public void purgeExpiredRecords() {
        if (!schedulerEnabled) {
            logger.debug("Expired record cleanup is disabled");
            return;
        }

        long startTime = System.currentTimeMillis();
        int locks = purge("lock", lockManager::purgeExpired);
        int cooldowns = purge("cooldown", cooldownTracker::purgeExpired);

        if (locks > 0 || cooldowns > 0) {
            logger.info("Cleanup completed: {} locks, {} cooldowns removed, duration: {}ms",
                    locks, cooldowns, System.currentTimeMillis() - startTime);
        }
    }

    private int purge(String recordType, PurgeOperation operation) {
        try {
            int removed = operation.purge();
            metricsService.recordCleanup(recordType, removed);
            return removed;
        } catch (Exception e) {
            logger.error("Error purging expired {} records", recordType, e);
            metricsService.recordError("CLEANUP_ERROR", "purgeExpired_" + recordType);
            return 0;
        }
    }

    @FunctionalInterface
    private interface PurgeOperation {
        int purge();
    }
}
