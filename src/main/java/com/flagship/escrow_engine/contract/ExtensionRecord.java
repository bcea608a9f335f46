package com.flagship.escrow_engine.contract;

import java.time.Instant;
import java.util.UUID;

/**
 * One applied extension, kept in contracts.extension_history.
 *
 * newPriceMinor is null when the extension did not change the price.
 */
public record ExtensionRecord(
    int days,
    Long previousPriceMinor,
    Long newPriceMinor,
    UUID requestedBy,
    Instant requestedAt,
    UUID acceptedBy,
    Instant acceptedAt,
    Instant previousEndDate,
    Instant newEndDate
) {
}
