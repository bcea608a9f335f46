package com.flagship.escrow_engine.contract;

import com.flagship.escrow_engine.audit.AuditCategory;
import com.flagship.escrow_engine.audit.AuditLogEntry;
import com.flagship.escrow_engine.audit.AuditSeverity;
import com.flagship.escrow_engine.audit.AuditTrailService;
import com.flagship.escrow_engine.audit.FieldChange;
import com.flagship.escrow_engine.contract.event.ContractCompletedEvent;
import com.flagship.escrow_engine.contract.event.ContractEvent;
import com.flagship.escrow_engine.contract.event.ContractStatusChangedEvent;
import com.flagship.escrow_engine.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Writes the outbox events and audit entry that accompany a contract change.
 *
 * Must be called inside the transaction that persists the change.
 * A null actor means the system performed the change.
 */
@Component
@RequiredArgsConstructor
public class ContractEventRecorder {

    public static final String AGGREGATE_TYPE = "Contract";

    private final OutboxService outboxService;
    private final AuditTrailService auditTrailService;

    public void recordCreated(Contract contract, UUID actor) {
        outboxService.saveEvent(AGGREGATE_TYPE, contract.getId(), ContractStatusChangedEvent.EVENT_TYPE,
                ContractStatusChangedEvent.of(null, contract, actor, contract.getCreatedAt()));
        audit(actor, "CONTRACT_CREATED", AuditSeverity.LOW, contract.getId(),
                "Contract created for " + contract.getTotalPrice(),
                List.of(FieldChange.of("status", null, contract.getStatus()),
                        FieldChange.of("totalPrice", null, contract.getTotalPrice())));
    }

    /**
     * Records a change. Status changes publish ContractStatusChanged, and a
     * contract reaching COMPLETED also publishes ContractCompleted.
     */
    public void recordChange(Contract before, Contract after, UUID actor, String action,
                             AuditSeverity severity, String description, Instant now) {
        if (before.getStatus() != after.getStatus()) {
            outboxService.saveEvent(AGGREGATE_TYPE, after.getId(), ContractStatusChangedEvent.EVENT_TYPE,
                    ContractStatusChangedEvent.of(before, after, actor, now));
            if (after.getStatus() == ContractStatus.COMPLETED) {
                outboxService.saveEvent(AGGREGATE_TYPE, after.getId(), ContractCompletedEvent.EVENT_TYPE,
                        ContractCompletedEvent.fromContract(after, actor == null, now));
            }
        }
        audit(actor, action, severity, after.getId(), description, diff(before, after));
    }

    public void publish(UUID contractId, ContractEvent event) {
        outboxService.saveEvent(AGGREGATE_TYPE, contractId, event.getEventType(), event);
    }

    private void audit(UUID actor, String action, AuditSeverity severity, UUID contractId,
                       String description, List<FieldChange> changes) {
        auditTrailService.record(AuditLogEntry.builder()
                .performedBy(actor)
                .action(action)
                .category(AuditCategory.CONTRACT)
                .severity(severity)
                .targetModel(AGGREGATE_TYPE)
                .targetId(contractId)
                .description(description)
                .changes(changes)
                .build());
    }

    static List<FieldChange> diff(Contract before, Contract after) {
        List<FieldChange> changes = new ArrayList<>();
        compare(changes, "status", before.getStatus(), after.getStatus());
        compare(changes, "escrowStatus", before.getEscrowStatus(), after.getEscrowStatus());
        compare(changes, "escrowAmount", before.getEscrowAmount(), after.getEscrowAmount());
        compare(changes, "basePrice", before.getBasePrice(), after.getBasePrice());
        compare(changes, "commission", before.getCommission(), after.getCommission());
        compare(changes, "totalPrice", before.getTotalPrice(), after.getTotalPrice());
        compare(changes, "endDate", before.getEndDate(), after.getEndDate());
        compare(changes, "extensionCount", before.getExtensionCount(), after.getExtensionCount());
        compare(changes, "pendingExtension", before.getPendingExtension(), after.getPendingExtension());
        compare(changes, "allocatedAmount", before.getAllocatedAmount(), after.getAllocatedAmount());
        compare(changes, "pairingCodeIssued", before.getPairingExpiry(), after.getPairingExpiry());
        compare(changes, "deleted", before.isDeleted(), after.isDeleted());
        return changes;
    }

    private static void compare(List<FieldChange> changes, String field, Object before, Object after) {
        if (!Objects.equals(before, after)) {
            changes.add(FieldChange.of(field, before, after));
        }
    }
}
