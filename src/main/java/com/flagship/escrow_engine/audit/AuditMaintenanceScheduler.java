package com.flagship.escrow_engine.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Scheduled edge for audit upkeep: queued write retries and retention cleanup.
 */
@Component
@ConditionalOnProperty(name = "escrow.automation.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AuditMaintenanceScheduler {

    private final AuditTrailService auditTrailService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${escrow.audit.retry-interval-ms:30000}")
    public void retryFailedWrites() {
        if (auditTrailService.pendingRetries() > 0) {
            auditTrailService.retryFailedWrites();
        }
    }

    @Scheduled(cron = "${escrow.audit.cleanup-cron:0 30 3 * * *}", zone = "UTC")
    public void cleanupExpired() {
        try {
            auditTrailService.cleanupExpired(clock.instant());
        } catch (Exception e) {
            log.error("Audit retention cleanup failed", e);
        }
    }
}
