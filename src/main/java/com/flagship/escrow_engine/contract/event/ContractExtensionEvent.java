package com.flagship.escrow_engine.contract.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an extension is requested, accepted or rejected.
 */
@Value
public class ContractExtensionEvent implements ContractEvent {
    UUID eventId;
    UUID contractId;
    String outcome;
    int days;
    Long newPriceMinor;
    UUID actorId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ContractExtension";

    public static final String REQUESTED = "REQUESTED";
    public static final String ACCEPTED = "ACCEPTED";
    public static final String REJECTED = "REJECTED";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ContractExtensionEvent of(UUID contractId, String outcome, int days, Long newPriceMinor,
                                            UUID actorId, Instant now) {
        return new ContractExtensionEvent(UUID.randomUUID(), contractId, outcome, days, newPriceMinor, actorId, now);
    }
}
