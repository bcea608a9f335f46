package com.flagship.escrow_engine.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.contract.Contract;
import com.flagship.escrow_engine.contract.ContractStatus;
import com.flagship.escrow_engine.money.EscrowState;
import com.flagship.escrow_engine.money.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Contract view for either party. The pairing code itself is never returned;
 * it travels only through the notification channel.
 */
@Value
@Builder
public class ContractResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("job_id")
    UUID jobId;

    @JsonProperty("requester_id")
    UUID requesterId;

    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("title")
    String title;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("base_price")
    BigDecimal basePrice;

    @JsonProperty("commission")
    BigDecimal commission;

    @JsonProperty("commission_rate")
    BigDecimal commissionRate;

    @JsonProperty("total_price")
    BigDecimal totalPrice;

    @JsonProperty("status")
    ContractStatus status;

    @JsonProperty("start_date")
    Instant startDate;

    @JsonProperty("end_date")
    Instant endDate;

    @JsonProperty("escrow_enabled")
    boolean escrowEnabled;

    @JsonProperty("escrow_amount")
    BigDecimal escrowAmount;

    @JsonProperty("escrow_status")
    EscrowState escrowStatus;

    @JsonProperty("pairing_expiry")
    Instant pairingExpiry;

    @JsonProperty("requester_confirmed")
    boolean requesterConfirmed;

    @JsonProperty("worker_confirmed")
    boolean workerConfirmed;

    @JsonProperty("extension_count")
    int extensionCount;

    @JsonProperty("pending_extension_days")
    Integer pendingExtensionDays;

    @JsonProperty("pending_extension_price")
    BigDecimal pendingExtensionPrice;

    @JsonProperty("allocated_amount")
    BigDecimal allocatedAmount;

    @JsonProperty("percentage_of_budget")
    BigDecimal percentageOfBudget;

    @JsonProperty("work_completed_at")
    Instant workCompletedAt;

    @JsonProperty("overdue_flagged_at")
    Instant overdueFlaggedAt;

    @JsonProperty("dispute_reason")
    String disputeReason;

    @JsonProperty("cancellation_reason")
    String cancellationReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ContractResponse from(Contract contract) {
        return ContractResponse.builder()
            .id(contract.getId())
            .jobId(contract.getJobId())
            .requesterId(contract.getRequesterId())
            .workerId(contract.getWorkerId())
            .title(contract.getTitle())
            .currency(contract.getCurrency().name())
            .basePrice(major(contract.getBasePrice()))
            .commission(major(contract.getCommission()))
            .commissionRate(contract.getCommissionRate().getPercent())
            .totalPrice(major(contract.getTotalPrice()))
            .status(contract.getStatus())
            .startDate(contract.getStartDate())
            .endDate(contract.getEndDate())
            .escrowEnabled(contract.isEscrowEnabled())
            .escrowAmount(major(contract.getEscrowAmount()))
            .escrowStatus(contract.getEscrowStatus())
            .pairingExpiry(contract.getPairingExpiry())
            .requesterConfirmed(contract.isRequesterConfirmed())
            .workerConfirmed(contract.isWorkerConfirmed())
            .extensionCount(contract.getExtensionCount())
            .pendingExtensionDays(contract.getPendingExtension() != null
                ? contract.getPendingExtension().getDays() : null)
            .pendingExtensionPrice(contract.getPendingExtension() != null
                ? major(contract.getPendingExtension().getNewPrice()) : null)
            .allocatedAmount(major(contract.getAllocatedAmount()))
            .percentageOfBudget(contract.getPercentageOfBudget())
            .workCompletedAt(contract.getWorkCompletedAt())
            .overdueFlaggedAt(contract.getOverdueFlaggedAt())
            .disputeReason(contract.getDisputeReason())
            .cancellationReason(contract.getCancellationReason())
            .createdAt(contract.getCreatedAt())
            .updatedAt(contract.getUpdatedAt())
            .build();
    }

    private static BigDecimal major(Money money) {
        return money != null ? money.toMajor() : null;
    }
}
