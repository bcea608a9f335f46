package com.flagship.escrow_engine.job;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One worker's share of a job budget: either an explicit amount in the job
 * currency's major units or a percentage of the job price, never both.
 */
@Value
@Builder
public class WorkerAllocation {
    UUID workerId;
    BigDecimal amount;
    BigDecimal percentage;
    @Builder.Default
    boolean escrowEnabled = true;
    Instant startDate;
    Instant endDate;
}
