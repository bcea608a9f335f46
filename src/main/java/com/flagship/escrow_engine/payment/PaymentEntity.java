package com.flagship.escrow_engine.payment;

import com.flagship.escrow_engine.money.CurrencyCode;
import com.flagship.escrow_engine.money.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA Entity for Payment persistence.
 *
 * Key design principles:
 * - No @Setter: Prevents bypassing invariants and domain rules
 * - Immutable fields: identity, parties, amount and kind are updatable = false
 * - Lifecycle hooks: @PrePersist and @PreUpdate handle timestamps
 * - Controlled factory: fromDomain() is the only way to create entities
 * - gateway_order_id and gateway_capture_id are unique, so a capture can only ever
 *   be applied to one payment
 */
@Entity
@Table(
    name = "payments",
    indexes = {
        @Index(name = "idx_payments_contract_status", columnList = "contract_id, status"),
        @Index(name = "idx_payments_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "contract_id", nullable = false, updatable = false)
    private UUID contractId;

    @Column(name = "payer_id", nullable = false, updatable = false)
    private UUID payerId;

    @Column(name = "recipient_id", nullable = false, updatable = false)
    private UUID recipientId;

    @Column(name = "amount_minor", nullable = false, updatable = false)
    private long amountMinor;

    @Column(name = "platform_fee_minor", nullable = false, updatable = false)
    private long platformFeeMinor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 24, updatable = false)
    private PaymentKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PaymentStatus status;

    @Column(nullable = false, updatable = false)
    private boolean escrow;

    @Column(name = "gateway_order_id", unique = true)
    private String gatewayOrderId;

    @Column(name = "approval_url", columnDefinition = "TEXT")
    private String approvalUrl;

    @Column(name = "order_created_at")
    private Instant orderCreatedAt;

    @Column(name = "gateway_capture_id", unique = true)
    private String gatewayCaptureId;

    @Column(name = "gateway_payer_id")
    private String gatewayPayerId;

    @Column(name = "payer_email")
    private String payerEmail;

    @Column(name = "captured_at")
    private Instant capturedAt;

    @Column(name = "escrow_released_at")
    private Instant escrowReleasedAt;

    @Column(name = "escrow_released_by")
    private UUID escrowReleasedBy;

    @Column(name = "auto_released", nullable = false)
    private boolean autoReleased;

    @Column(name = "refund_requested_at")
    private Instant refundRequestedAt;

    @Column(name = "refund_id")
    private String refundId;

    @Column(name = "refund_reason", columnDefinition = "TEXT")
    private String refundReason;

    @Column(name = "refunded_by")
    private UUID refundedBy;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(nullable = false)
    private Long version;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Controlled factory method to create entity from domain object.
     */
    static PaymentEntity fromDomain(Payment payment) {
        PaymentEntity entity = new PaymentEntity();
        entity.id = payment.getId();
        entity.contractId = payment.getContractId();
        entity.payerId = payment.getPayerId();
        entity.recipientId = payment.getRecipientId();
        entity.amountMinor = payment.getAmount().getMinorUnits();
        entity.platformFeeMinor = payment.getPlatformFee().getMinorUnits();
        entity.currency = payment.getAmount().getCurrency();
        entity.kind = payment.getKind();
        entity.escrow = payment.isEscrow();
        entity.createdAt = payment.getCreatedAt();
        entity.updateFromDomain(payment);
        return entity;
    }

    public Payment toDomain() {
        return Payment.builder()
            .id(id)
            .contractId(contractId)
            .payerId(payerId)
            .recipientId(recipientId)
            .amount(Money.of(amountMinor, currency))
            .platformFee(Money.of(platformFeeMinor, currency))
            .kind(kind)
            .status(status)
            .escrow(escrow)
            .gatewayOrderId(gatewayOrderId)
            .approvalUrl(approvalUrl)
            .orderCreatedAt(orderCreatedAt)
            .gatewayCaptureId(gatewayCaptureId)
            .gatewayPayerId(gatewayPayerId)
            .payerEmail(payerEmail)
            .capturedAt(capturedAt)
            .escrowReleasedAt(escrowReleasedAt)
            .escrowReleasedBy(escrowReleasedBy)
            .autoReleased(autoReleased)
            .refundRequestedAt(refundRequestedAt)
            .refundId(refundId)
            .refundReason(refundReason)
            .refundedBy(refundedBy)
            .refundedAt(refundedAt)
            .failureReason(failureReason)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Updates the mutable fields from a domain object.
     * Identity, parties, amount, fee, kind and escrow mode cannot be changed.
     */
    void updateFromDomain(Payment payment) {
        this.status = payment.getStatus();
        this.gatewayOrderId = payment.getGatewayOrderId();
        this.approvalUrl = payment.getApprovalUrl();
        this.orderCreatedAt = payment.getOrderCreatedAt();
        this.gatewayCaptureId = payment.getGatewayCaptureId();
        this.gatewayPayerId = payment.getGatewayPayerId();
        this.payerEmail = payment.getPayerEmail();
        this.capturedAt = payment.getCapturedAt();
        this.escrowReleasedAt = payment.getEscrowReleasedAt();
        this.escrowReleasedBy = payment.getEscrowReleasedBy();
        this.autoReleased = payment.isAutoReleased();
        this.refundRequestedAt = payment.getRefundRequestedAt();
        this.refundId = payment.getRefundId();
        this.refundReason = payment.getRefundReason();
        this.refundedBy = payment.getRefundedBy();
        this.refundedAt = payment.getRefundedAt();
        this.failureReason = payment.getFailureReason();
    }
}
