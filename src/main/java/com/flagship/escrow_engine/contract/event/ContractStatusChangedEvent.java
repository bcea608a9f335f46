package com.flagship.escrow_engine.contract.event;

import com.flagship.escrow_engine.contract.Contract;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published on every contract status change.
 */
@Value
public class ContractStatusChangedEvent implements ContractEvent {
    UUID eventId;
    UUID contractId;
    UUID jobId;
    UUID requesterId;
    UUID workerId;
    String fromStatus;
    String toStatus;
    UUID actorId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ContractStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ContractStatusChangedEvent of(Contract before, Contract after, UUID actorId, Instant now) {
        return new ContractStatusChangedEvent(
            UUID.randomUUID(),
            after.getId(),
            after.getJobId(),
            after.getRequesterId(),
            after.getWorkerId(),
            before != null ? before.getStatus().name() : null,
            after.getStatus().name(),
            actorId,
            now
        );
    }
}
