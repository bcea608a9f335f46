package com.flagship.escrow_engine.audit;

import com.flagship.escrow_engine.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Appends signed audit entries.
 *
 * Entries are signed when recorded but written only after the surrounding
 * business transaction commits, in a transaction of their own. A failed write
 * never propagates: it is reported on the audit.errors logger and queued for
 * {@link #retryFailedWrites()}.
 */
@Service
@Slf4j
public class AuditTrailService {

    private static final Logger AUDIT_ERRORS = LoggerFactory.getLogger("audit.errors");

    private final AuditLogRepository repository;
    private final AuditSigner signer;
    private final AuditProperties properties;
    private final Clock clock;
    private final TransactionTemplate writeTemplate;

    private final Queue<AuditLogEntry> retryQueue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger retryQueueSize = new AtomicInteger();

    public AuditTrailService(AuditLogRepository repository,
                             AuditSigner signer,
                             AuditProperties properties,
                             Clock clock,
                             PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.signer = signer;
        this.properties = properties;
        this.clock = clock;
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Completes, signs and schedules an entry for writing.
     *
     * @param draft entry without id, timestamp, request metadata or signature
     * @return the signed entry as it will be stored
     */
    public AuditLogEntry record(AuditLogEntry draft) {
        AuditLogEntry completed = draft.toBuilder()
            .id(UUID.randomUUID())
            .createdAt(clock.instant())
            .ipAddress(draft.getIpAddress() != null ? draft.getIpAddress() : CorrelationContext.getClientIp())
            .userAgent(draft.getUserAgent() != null ? draft.getUserAgent() : CorrelationContext.getUserAgent())
            .correlationId(CorrelationContext.hasCorrelationId() ? CorrelationContext.getCorrelationId() : null)
            .signature(null)
            .build();
        AuditLogEntry signed = completed.toBuilder().signature(signer.sign(completed)).build();

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    write(signed);
                }
            });
        } else {
            write(signed);
        }
        return signed;
    }

    /**
     * @return true if the entry carries a valid signature for its current content
     */
    public boolean verifySignature(AuditLogEntry entry) {
        return signer.verify(entry);
    }

    /**
     * Deletes LOW and MEDIUM entries older than the retention window.
     *
     * @return number of deleted entries
     */
    @Transactional
    public int cleanupExpired(Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(properties.getRetentionDays()));
        Set<AuditSeverity> expiring = EnumSet.noneOf(AuditSeverity.class);
        for (AuditSeverity severity : AuditSeverity.values()) {
            if (!severity.isRetentionExempt()) {
                expiring.add(severity);
            }
        }
        int deleted = repository.deleteExpired(cutoff, expiring);
        log.info("Audit retention cleanup: cutoff={}, deleted={}", cutoff, deleted);
        return deleted;
    }

    /**
     * Writes queued entries again. Stops at the first failure; the rest stay queued.
     *
     * @return number of entries written
     */
    public int retryFailedWrites() {
        int written = 0;
        AuditLogEntry entry;
        while ((entry = retryQueue.peek()) != null) {
            if (!tryWrite(entry)) {
                break;
            }
            retryQueue.poll();
            retryQueueSize.decrementAndGet();
            written++;
        }
        if (written > 0) {
            log.info("Wrote {} queued audit entries, {} remaining", written, retryQueueSize.get());
        }
        return written;
    }

    public int pendingRetries() {
        return retryQueueSize.get();
    }

    private void write(AuditLogEntry entry) {
        if (!tryWrite(entry)) {
            enqueue(entry);
        }
    }

    private boolean tryWrite(AuditLogEntry entry) {
        try {
            writeTemplate.executeWithoutResult(status -> repository.save(AuditLogEntity.fromDomain(entry)));
            return true;
        } catch (RuntimeException e) {
            AUDIT_ERRORS.error("Audit write failed: id={}, action={}, target={}:{}, error={}",
                    entry.getId(), entry.getAction(), entry.getTargetModel(), entry.getTargetId(), e.getMessage());
            return false;
        }
    }

    private void enqueue(AuditLogEntry entry) {
        if (retryQueueSize.get() >= properties.getRetryQueueCapacity()) {
            AUDIT_ERRORS.error("Audit retry queue full ({}), dropping entry: id={}, action={}, canonical={}",
                    properties.getRetryQueueCapacity(), entry.getId(), entry.getAction(), entry.canonicalForm());
            return;
        }
        retryQueue.add(entry);
        retryQueueSize.incrementAndGet();
    }
}
