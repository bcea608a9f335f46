package com.flagship.escrow_engine.payment;

import com.flagship.escrow_engine.contract.Contract;
import com.flagship.escrow_engine.exception.InvalidTransitionException;
import com.flagship.escrow_engine.gateway.GatewayCapture;
import com.flagship.escrow_engine.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Payment domain object: one charge of the requester for a contract.
 *
 * Key principles:
 * - Status transitions are explicit and validated
 * - State changes are immutable (every transition returns a new Payment)
 * - amount never changes after creation; a repriced contract gets a new payment
 */
@Value
@Builder(toBuilder = true)
public class Payment {
    UUID id;
    UUID contractId;
    UUID payerId;
    UUID recipientId;
    Money amount;
    Money platformFee;
    PaymentKind kind;
    PaymentStatus status;
    boolean escrow;

    String gatewayOrderId;
    String approvalUrl;
    Instant orderCreatedAt;

    String gatewayCaptureId;
    String gatewayPayerId;
    String payerEmail;
    Instant capturedAt;

    Instant escrowReleasedAt;
    UUID escrowReleasedBy;
    boolean autoReleased;

    Instant refundRequestedAt;
    String refundId;
    String refundReason;
    UUID refundedBy;
    Instant refundedAt;

    String failureReason;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a PENDING payment charging the requester of a contract.
     */
    public static Payment pending(UUID id, Contract contract, Money amount, Money platformFee,
                                  PaymentKind kind, Instant now) {
        return Payment.builder()
            .id(id)
            .contractId(contract.getId())
            .payerId(contract.getRequesterId())
            .recipientId(contract.getWorkerId())
            .amount(amount)
            .platformFee(platformFee)
            .kind(kind)
            .status(PaymentStatus.PENDING)
            .escrow(contract.isEscrowEnabled())
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Attaches the gateway order. Only once, only while PENDING.
     */
    public Payment withOrder(String orderId, String approvalUrl, Instant now) {
        requireStatus(PaymentStatus.PENDING, "attach an order to");
        if (gatewayOrderId != null) {
            throw new InvalidTransitionException("Payment " + id + " already has gateway order " + gatewayOrderId);
        }
        return toBuilder()
            .gatewayOrderId(orderId)
            .approvalUrl(approvalUrl)
            .orderCreatedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * PENDING -> HELD_ESCROW (escrow) or COMPLETED (no escrow).
     */
    public Payment capture(GatewayCapture capture, Instant now) {
        if (status != PaymentStatus.PENDING) {
            throw InvalidTransitionException.of("payment", id, status, captureTarget());
        }
        if (refundRequestedAt != null) {
            throw new InvalidTransitionException("Payment " + id + " has a refund in progress");
        }
        return withCapture(capture, now).status(captureTarget()).build();
    }

    /**
     * Records a capture that arrived while a refund is in flight. The payment stays
     * PENDING and the refund returns the captured money.
     */
    public Payment recordCaptureDuringRefund(GatewayCapture capture, Instant now) {
        requireStatus(PaymentStatus.PENDING, "record a capture on");
        if (refundRequestedAt == null) {
            throw new InvalidTransitionException("Payment " + id + " has no refund in progress");
        }
        requireNotCaptured();
        return withCapture(capture, now).build();
    }

    /**
     * PENDING -> HELD_ESCROW or COMPLETED for a capture recorded during a refund
     * that did not go through.
     */
    public Payment applyRecordedCapture(Instant now) {
        if (status != PaymentStatus.PENDING || !isCaptured() || refundRequestedAt != null) {
            throw InvalidTransitionException.of("payment", id, status, captureTarget());
        }
        return toBuilder().status(captureTarget()).updatedAt(now).build();
    }

    /**
     * Records a capture that reached a FAILED or REFUNDED payment. The status stays;
     * the money has to go back to the payer.
     */
    public Payment recordLateCapture(GatewayCapture capture, Instant now) {
        if (!isClosedWithoutFunds()) {
            throw new InvalidTransitionException(
                String.format("Cannot record a late capture on payment %s in %s status", id, status));
        }
        requireNotCaptured();
        return withCapture(capture, now).build();
    }

    /**
     * Marks the late capture of a FAILED or REFUNDED payment as returned to the payer.
     */
    public Payment recordLateCaptureRefund(String gatewayRefundId, Instant now) {
        if (!awaitsLateCaptureRefund()) {
            throw new InvalidTransitionException("Payment " + id + " has no late capture to refund");
        }
        return toBuilder()
            .refundId(gatewayRefundId)
            .refundedAt(refundedAt != null ? refundedAt : now)
            .updatedAt(now)
            .build();
    }

    /**
     * HELD_ESCROW -> COMPLETED. Blocked while a refund is in flight.
     *
     * @param releasedBy user who released, or null when the scheduler did
     */
    public Payment release(UUID releasedBy, Instant now) {
        if (status != PaymentStatus.HELD_ESCROW) {
            throw InvalidTransitionException.of("payment", id, status, PaymentStatus.COMPLETED);
        }
        if (refundRequestedAt != null) {
            throw new InvalidTransitionException("Payment " + id + " has a refund in progress");
        }
        return toBuilder()
            .status(PaymentStatus.COMPLETED)
            .escrowReleasedAt(now)
            .escrowReleasedBy(releasedBy)
            .autoReleased(releasedBy == null)
            .updatedAt(now)
            .build();
    }

    /**
     * Claims the payment for a refund before the gateway is called.
     */
    public Payment claimRefund(Instant now) {
        requireRefundable();
        if (refundRequestedAt != null) {
            throw new InvalidTransitionException("Payment " + id + " already has a refund in progress");
        }
        return toBuilder().refundRequestedAt(now).updatedAt(now).build();
    }

    public Payment releaseRefundClaim(Instant now) {
        return toBuilder().refundRequestedAt(null).updatedAt(now).build();
    }

    /**
     * PENDING | HELD_ESCROW -> REFUNDED.
     *
     * @param refundId gateway refund id, null when nothing had been captured
     */
    public Payment refund(String refundId, String reason, UUID actor, Instant now) {
        requireRefundable();
        return toBuilder()
            .status(PaymentStatus.REFUNDED)
            .refundId(refundId)
            .refundReason(reason)
            .refundedBy(actor)
            .refundedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * PENDING -> FAILED.
     */
    public Payment fail(String reason, Instant now) {
        if (status != PaymentStatus.PENDING) {
            throw InvalidTransitionException.of("payment", id, status, PaymentStatus.FAILED);
        }
        return toBuilder()
            .status(PaymentStatus.FAILED)
            .failureReason(reason)
            .updatedAt(now)
            .build();
    }

    public boolean hasOrder() {
        return gatewayOrderId != null;
    }

    public boolean isCaptured() {
        return gatewayCaptureId != null;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * True for a FAILED or REFUNDED payment that was captured at the gateway and whose
     * capture has not been refunded yet.
     */
    public boolean awaitsLateCaptureRefund() {
        return isClosedWithoutFunds() && isCaptured() && refundId == null;
    }

    private boolean isClosedWithoutFunds() {
        return status == PaymentStatus.FAILED || status == PaymentStatus.REFUNDED;
    }

    private PaymentStatus captureTarget() {
        return escrow ? PaymentStatus.HELD_ESCROW : PaymentStatus.COMPLETED;
    }

    private PaymentBuilder withCapture(GatewayCapture capture, Instant now) {
        return toBuilder()
            .gatewayCaptureId(capture.getCaptureId())
            .gatewayPayerId(capture.getPayerId())
            .payerEmail(capture.getPayerEmail())
            .capturedAt(now)
            .updatedAt(now);
    }

    private void requireNotCaptured() {
        if (isCaptured()) {
            throw new InvalidTransitionException("Payment " + id + " already has capture " + gatewayCaptureId);
        }
    }

    private void requireRefundable() {
        if (status != PaymentStatus.PENDING && status != PaymentStatus.HELD_ESCROW) {
            throw InvalidTransitionException.of("payment", id, status, PaymentStatus.REFUNDED);
        }
    }

    private void requireStatus(PaymentStatus expected, String action) {
        if (status != expected) {
            throw new InvalidTransitionException(
                String.format("Cannot %s payment %s in %s status", action, id, status));
        }
    }
}
