package com.flagship.escrow_engine.payment.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for payment events.
 *
 * All payment events share these common properties:
 * - Event ID for deduplication
 * - Payment and contract ids
 * - Timestamp of when the event occurred
 *
 * Amounts travel as minor units plus an ISO currency code.
 */
public interface PaymentEvent {

    UUID getEventId();

    UUID getPaymentId();

    UUID getContractId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
