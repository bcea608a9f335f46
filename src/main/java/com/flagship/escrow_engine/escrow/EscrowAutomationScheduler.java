package com.flagship.escrow_engine.escrow;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.function.IntSupplier;

/**
 * Cron edge of {@link EscrowAutomationService}. Each tick passes the current
 * clock instant; overlapping nodes are safe because every contract is claimed
 * with SKIP LOCKED.
 */
@Component
@ConditionalOnProperty(name = "escrow.automation.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class EscrowAutomationScheduler {

    private final EscrowAutomationService automationService;
    private final Clock clock;

    @Scheduled(cron = "${escrow.automation.auto-release-cron:0 0 * * * *}", zone = "UTC")
    public void autoRelease() {
        run(EscrowAutomationService.AUTO_RELEASE, () -> automationService.sweepAutoRelease(clock.instant()));
    }

    @Scheduled(cron = "${escrow.automation.reminder-cron:0 0 */6 * * *}", zone = "UTC")
    public void approvalReminders() {
        run(EscrowAutomationService.REMINDER, () -> automationService.sweepReminders(clock.instant()));
    }

    @Scheduled(cron = "${escrow.automation.overdue-cron:0 15 * * * *}", zone = "UTC")
    public void overdueContracts() {
        run(EscrowAutomationService.OVERDUE, () -> automationService.sweepOverdue(clock.instant()));
    }

    @Scheduled(cron = "${escrow.automation.pairing-expiry-cron:0 */5 * * * *}", zone = "UTC")
    public void expiredPairingCodes() {
        run(EscrowAutomationService.PAIRING_EXPIRY, () -> automationService.sweepPairingExpiry(clock.instant()));
    }

    @Scheduled(cron = "${escrow.automation.scheduled-start-cron:0 */15 * * * *}", zone = "UTC")
    public void scheduledStarts() {
        run(EscrowAutomationService.SCHEDULED_START, () -> automationService.sweepScheduledStarts(clock.instant()));
    }

    @Scheduled(cron = "${escrow.automation.stale-orders-cron:0 30 * * * *}", zone = "UTC")
    public void staleOrders() {
        run(EscrowAutomationService.STALE_ORDERS, () -> automationService.sweepStaleOrders(clock.instant()));
    }

    private void run(String sweep, IntSupplier task) {
        try {
            int processed = task.getAsInt();
            log.debug("Sweep {} tick done, processed={}", sweep, processed);
        } catch (Exception e) {
            log.error("Sweep {} tick failed", sweep, e);
        }
    }
}
