package com.flagship.escrow_engine.payment;

import com.flagship.escrow_engine.contract.ContractService;
import com.flagship.escrow_engine.payment.dto.CaptureRequest;
import com.flagship.escrow_engine.payment.dto.PaymentResponse;
import com.flagship.escrow_engine.payment.dto.RefundRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Payment endpoints: gateway orders, capture, escrow release and refunds.
 *
 * Capture is idempotent on the gateway order id, so a client retrying after a
 * timeout gets the stored payment back instead of a second charge.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private static final String USER_HEADER = "X-User-Id";

    private final PaymentLedgerService paymentLedger;
    private final ContractService contractService;

    @PostMapping("/contracts/{id}/payment-order")
    public ResponseEntity<PaymentResponse> createPaymentOrder(@PathVariable("id") UUID contractId,
                                                              @RequestHeader(USER_HEADER) UUID actor) {
        long startTime = System.currentTimeMillis();
        Payment payment = paymentLedger.createContractPaymentOrder(contractId, actor);
        log.info("Payment order ready: contractId={}, paymentId={}, orderId={}, duration={}ms",
                contractId, payment.getId(), payment.getGatewayOrderId(), System.currentTimeMillis() - startTime);
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment));
    }

    @GetMapping("/contracts/{id}/payments")
    public ResponseEntity<List<PaymentResponse>> listContractPayments(@PathVariable("id") UUID contractId,
                                                                      @RequestHeader(USER_HEADER) UUID actor) {
        contractService.getContract(contractId).partyOf(actor);
        return ResponseEntity.ok(paymentLedger.findByContract(contractId).stream()
            .map(PaymentResponse::from)
            .toList());
    }

    @PostMapping("/payments/capture")
    public ResponseEntity<PaymentResponse> capture(@Valid @RequestBody CaptureRequest request) {
        Payment payment = paymentLedger.captureContractPayment(request.getOrderId());
        return ResponseEntity.ok(PaymentResponse.from(payment));
    }

    @PostMapping("/payments/{id}/release")
    public ResponseEntity<PaymentResponse> release(@PathVariable("id") UUID paymentId,
                                                   @RequestHeader(USER_HEADER) UUID actor) {
        ReleaseResult result = paymentLedger.releaseEscrow(paymentId, actor);
        if (!result.isTransitioned()) {
            log.info("Payment {} was already released", paymentId);
        }
        return ResponseEntity.ok(PaymentResponse.from(result.getPayment()));
    }

    @PostMapping("/payments/{id}/refund")
    public ResponseEntity<PaymentResponse> refund(@PathVariable("id") UUID paymentId,
                                                  @RequestHeader(USER_HEADER) UUID actor,
                                                  @Valid @RequestBody RefundRequest request) {
        return ResponseEntity.ok(PaymentResponse.from(paymentLedger.refund(paymentId, request.getReason(), actor)));
    }

    @GetMapping("/payments/{id}")
    public ResponseEntity<PaymentResponse> getPayment(@PathVariable("id") UUID paymentId,
                                                      @RequestHeader(USER_HEADER) UUID actor) {
        Payment payment = paymentLedger.getPayment(paymentId);
        contractService.getContract(payment.getContractId()).partyOf(actor);
        return ResponseEntity.ok(PaymentResponse.from(payment));
    }
}
