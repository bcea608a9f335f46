package com.flagship.escrow_engine.contract;

import com.flagship.escrow_engine.money.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Input for a new contract. jobId, allocatedAmount and percentageOfBudget are set
 * only for contracts carved out of a multi-worker job.
 */
@Value
@Builder
public class CreateContractCommand {
    UUID requesterId;
    UUID workerId;
    UUID jobId;
    String title;
    Money basePrice;
    Instant startDate;
    Instant endDate;
    boolean escrowEnabled;
    Money allocatedAmount;
    BigDecimal percentageOfBudget;
}
