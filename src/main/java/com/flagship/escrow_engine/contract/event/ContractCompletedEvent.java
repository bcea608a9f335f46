package com.flagship.escrow_engine.contract.event;

import com.flagship.escrow_engine.contract.Contract;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a contract reaches COMPLETED.
 *
 * Consumed by the referral consumer to detect a member's first completed contract.
 */
@Value
public class ContractCompletedEvent implements ContractEvent {
    UUID eventId;
    UUID contractId;
    UUID requesterId;
    UUID workerId;
    long totalPriceMinor;
    String currency;
    boolean autoReleased;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ContractCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ContractCompletedEvent fromContract(Contract contract, boolean autoReleased, Instant now) {
        return new ContractCompletedEvent(
            UUID.randomUUID(),
            contract.getId(),
            contract.getRequesterId(),
            contract.getWorkerId(),
            contract.getTotalPrice().getMinorUnits(),
            contract.getCurrency().name(),
            autoReleased,
            now
        );
    }
}
