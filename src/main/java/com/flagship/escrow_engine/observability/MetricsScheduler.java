package com.flagship.escrow_engine.observability;

import com.flagship.escrow_engine.audit.AuditTrailService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need a database query.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final EscrowMetrics escrowMetrics;
    private final AuditTrailService auditTrailService;

    @PostConstruct
    void registerGauges() {
        escrowMetrics.registerAuditRetryGauge(auditTrailService::pendingRetries);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }
}
