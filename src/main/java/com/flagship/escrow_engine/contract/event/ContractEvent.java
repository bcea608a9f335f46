package com.flagship.escrow_engine.contract.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for contract events written to the outbox.
 */
public interface ContractEvent {

    UUID getEventId();

    UUID getContractId();

    Instant getOccurredAt();

    String getEventType();
}
