package com.flagship.escrow_engine.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.payment.Payment;
import com.flagship.escrow_engine.payment.PaymentKind;
import com.flagship.escrow_engine.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("contract_id")
    UUID contractId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("platform_fee")
    BigDecimal platformFee;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("kind")
    PaymentKind kind;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("escrow")
    boolean escrow;

    @JsonProperty("gateway_order_id")
    String gatewayOrderId;

    @JsonProperty("approval_url")
    String approvalUrl;

    @JsonProperty("captured_at")
    Instant capturedAt;

    @JsonProperty("escrow_released_at")
    Instant escrowReleasedAt;

    @JsonProperty("auto_released")
    boolean autoReleased;

    @JsonProperty("refunded_at")
    Instant refundedAt;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .contractId(payment.getContractId())
            .amount(payment.getAmount().toMajor())
            .platformFee(payment.getPlatformFee() != null ? payment.getPlatformFee().toMajor() : null)
            .currency(payment.getAmount().getCurrency().name())
            .kind(payment.getKind())
            .status(payment.getStatus())
            .escrow(payment.isEscrow())
            .gatewayOrderId(payment.getGatewayOrderId())
            .approvalUrl(payment.getApprovalUrl())
            .capturedAt(payment.getCapturedAt())
            .escrowReleasedAt(payment.getEscrowReleasedAt())
            .autoReleased(payment.isAutoReleased())
            .refundedAt(payment.getRefundedAt())
            .failureReason(payment.getFailureReason())
            .createdAt(payment.getCreatedAt())
            .updatedAt(payment.getUpdatedAt())
            .build();
    }
}
