package com.flagship.escrow_engine.contract;

import com.flagship.escrow_engine.money.CommissionRate;
import com.flagship.escrow_engine.money.CurrencyCode;
import com.flagship.escrow_engine.money.EscrowState;
import com.flagship.escrow_engine.money.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for contracts.
 *
 * Money is stored as minor units plus a single currency column.
 * No setters: state changes arrive as a {@link Contract} through updateFromDomain().
 * Identity, parties and the commission rate are fixed after insert.
 */
@Entity
@Table(
    name = "contracts",
    indexes = {
        @Index(name = "idx_contracts_status", columnList = "status"),
        @Index(name = "idx_contracts_job_id", columnList = "job_id"),
        @Index(name = "idx_contracts_requester_created", columnList = "requester_id, created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ContractEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "job_id", updatable = false)
    private UUID jobId;

    @Column(name = "requester_id", nullable = false, updatable = false)
    private UUID requesterId;

    @Column(name = "worker_id", nullable = false, updatable = false)
    private UUID workerId;

    @Column(name = "title")
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(name = "base_price_minor", nullable = false)
    private long basePriceMinor;

    @Column(name = "commission_minor", nullable = false)
    private long commissionMinor;

    @Column(name = "total_price_minor", nullable = false)
    private long totalPriceMinor;

    @Column(name = "commission_rate", nullable = false, precision = 5, scale = 2, updatable = false)
    private BigDecimal commissionRate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ContractStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", length = 32)
    private ContractStatus previousStatus;

    @Column(name = "start_date")
    private Instant startDate;

    @Column(name = "end_date")
    private Instant endDate;

    @Column(name = "escrow_enabled", nullable = false, updatable = false)
    private boolean escrowEnabled;

    @Column(name = "escrow_amount_minor", nullable = false)
    private long escrowAmountMinor;

    @Enumerated(EnumType.STRING)
    @Column(name = "escrow_status", nullable = false, length = 16)
    private EscrowState escrowStatus;

    @Column(name = "pairing_code", length = 6)
    private String pairingCode;

    @Column(name = "pairing_expiry")
    private Instant pairingExpiry;

    @Column(name = "requester_confirmed", nullable = false)
    private boolean requesterConfirmed;

    @Column(name = "worker_confirmed", nullable = false)
    private boolean workerConfirmed;

    @Column(name = "requester_signed_off", nullable = false)
    private boolean requesterSignedOff;

    @Column(name = "worker_signed_off", nullable = false)
    private boolean workerSignedOff;

    @Column(name = "extension_count", nullable = false)
    private int extensionCount;

    @Convert(converter = ExtensionHistoryConverter.class)
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "extension_history", nullable = false, columnDefinition = "jsonb")
    private List<ExtensionRecord> extensionHistory;

    @Column(name = "pending_extension_days")
    private Integer pendingExtensionDays;

    @Column(name = "pending_new_price_minor")
    private Long pendingNewPriceMinor;

    @Column(name = "pending_extension_requested_by")
    private UUID pendingExtensionRequestedBy;

    @Column(name = "pending_extension_requested_at")
    private Instant pendingExtensionRequestedAt;

    @Column(name = "allocated_amount_minor")
    private Long allocatedAmountMinor;

    @Column(name = "percentage_of_budget", precision = 5, scale = 2)
    private BigDecimal percentageOfBudget;

    @Column(name = "work_completed_at")
    private Instant workCompletedAt;

    @Column(name = "approval_reminder_sent_at")
    private Instant approvalReminderSentAt;

    @Column(name = "overdue_flagged_at")
    private Instant overdueFlaggedAt;

    @Column(name = "disputed_by")
    private UUID disputedBy;

    @Column(name = "dispute_reason", columnDefinition = "TEXT")
    private String disputeReason;

    @Column(name = "disputed_at")
    private Instant disputedAt;

    @Column(name = "cancellation_reason", columnDefinition = "TEXT")
    private String cancellationReason;

    @Column(nullable = false)
    private boolean deleted;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "deleted_by")
    private UUID deletedBy;

    @Column(name = "deletion_reason", columnDefinition = "TEXT")
    private String deletionReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(nullable = false)
    private Long version;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Controlled factory: the only way to create a ContractEntity.
     */
    static ContractEntity fromDomain(Contract contract) {
        ContractEntity entity = new ContractEntity();
        entity.id = contract.getId();
        entity.jobId = contract.getJobId();
        entity.requesterId = contract.getRequesterId();
        entity.workerId = contract.getWorkerId();
        entity.currency = contract.getCurrency();
        entity.commissionRate = contract.getCommissionRate().getPercent();
        entity.escrowEnabled = contract.isEscrowEnabled();
        entity.createdAt = contract.getCreatedAt();
        entity.updateFromDomain(contract);
        return entity;
    }

    public Contract toDomain() {
        PendingExtension pending = pendingExtensionDays == null ? null : new PendingExtension(
            pendingExtensionDays,
            pendingNewPriceMinor != null ? money(pendingNewPriceMinor) : null,
            pendingExtensionRequestedBy,
            pendingExtensionRequestedAt
        );
        return Contract.builder()
            .id(id)
            .jobId(jobId)
            .requesterId(requesterId)
            .workerId(workerId)
            .title(title)
            .basePrice(money(basePriceMinor))
            .commission(money(commissionMinor))
            .totalPrice(money(totalPriceMinor))
            .commissionRate(CommissionRate.of(commissionRate))
            .status(status)
            .previousStatus(previousStatus)
            .startDate(startDate)
            .endDate(endDate)
            .escrowEnabled(escrowEnabled)
            .escrowAmount(money(escrowAmountMinor))
            .escrowStatus(escrowStatus)
            .pairingCode(pairingCode)
            .pairingExpiry(pairingExpiry)
            .requesterConfirmed(requesterConfirmed)
            .workerConfirmed(workerConfirmed)
            .requesterSignedOff(requesterSignedOff)
            .workerSignedOff(workerSignedOff)
            .extensionCount(extensionCount)
            .extensionHistory(extensionHistory != null ? List.copyOf(extensionHistory) : List.of())
            .pendingExtension(pending)
            .allocatedAmount(allocatedAmountMinor != null ? money(allocatedAmountMinor) : null)
            .percentageOfBudget(percentageOfBudget)
            .workCompletedAt(workCompletedAt)
            .approvalReminderSentAt(approvalReminderSentAt)
            .overdueFlaggedAt(overdueFlaggedAt)
            .disputedBy(disputedBy)
            .disputeReason(disputeReason)
            .disputedAt(disputedAt)
            .cancellationReason(cancellationReason)
            .deleted(deleted)
            .deletedAt(deletedAt)
            .deletedBy(deletedBy)
            .deletionReason(deletionReason)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the mutable state of a contract onto this entity.
     * Identity, parties, currency, commission rate and escrow mode are not touched.
     */
    void updateFromDomain(Contract contract) {
        this.title = contract.getTitle();
        this.basePriceMinor = contract.getBasePrice().getMinorUnits();
        this.commissionMinor = contract.getCommission().getMinorUnits();
        this.totalPriceMinor = contract.getTotalPrice().getMinorUnits();
        this.status = contract.getStatus();
        this.previousStatus = contract.getPreviousStatus();
        this.startDate = contract.getStartDate();
        this.endDate = contract.getEndDate();
        this.escrowAmountMinor = contract.getEscrowAmount().getMinorUnits();
        this.escrowStatus = contract.getEscrowStatus();
        this.pairingCode = contract.getPairingCode();
        this.pairingExpiry = contract.getPairingExpiry();
        this.requesterConfirmed = contract.isRequesterConfirmed();
        this.workerConfirmed = contract.isWorkerConfirmed();
        this.requesterSignedOff = contract.isRequesterSignedOff();
        this.workerSignedOff = contract.isWorkerSignedOff();
        this.extensionCount = contract.getExtensionCount();
        this.extensionHistory = List.copyOf(contract.getExtensionHistory());

        PendingExtension pending = contract.getPendingExtension();
        this.pendingExtensionDays = pending != null ? pending.getDays() : null;
        this.pendingNewPriceMinor = pending != null && pending.changesPrice()
            ? pending.getNewPrice().getMinorUnits() : null;
        this.pendingExtensionRequestedBy = pending != null ? pending.getRequestedBy() : null;
        this.pendingExtensionRequestedAt = pending != null ? pending.getRequestedAt() : null;

        this.allocatedAmountMinor = contract.getAllocatedAmount() != null
            ? contract.getAllocatedAmount().getMinorUnits() : null;
        this.percentageOfBudget = contract.getPercentageOfBudget();
        this.workCompletedAt = contract.getWorkCompletedAt();
        this.approvalReminderSentAt = contract.getApprovalReminderSentAt();
        this.overdueFlaggedAt = contract.getOverdueFlaggedAt();
        this.disputedBy = contract.getDisputedBy();
        this.disputeReason = contract.getDisputeReason();
        this.disputedAt = contract.getDisputedAt();
        this.cancellationReason = contract.getCancellationReason();
        this.deleted = contract.isDeleted();
        this.deletedAt = contract.getDeletedAt();
        this.deletedBy = contract.getDeletedBy();
        this.deletionReason = contract.getDeletionReason();
    }

    private Money money(long minorUnits) {
        return Money.of(minorUnits, currency);
    }
}
