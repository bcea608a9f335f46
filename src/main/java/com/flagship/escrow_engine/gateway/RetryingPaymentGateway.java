package com.flagship.escrow_engine.gateway;

import com.flagship.escrow_engine.exception.GatewayRejectedException;
import com.flagship.escrow_engine.exception.GatewayUnavailableException;
import com.flagship.escrow_engine.exception.PaymentPendingRetryException;
import com.flagship.escrow_engine.money.Money;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.util.function.Supplier;

/**
 * Decorates a provider with bounded retries and a circuit breaker.
 *
 * - GatewayUnavailableException is retried with backoff; once attempts are
 *   exhausted (or the circuit is open) the caller gets PaymentPendingRetryException
 * - GatewayRejectedException passes through on the first occurrence
 */
@Slf4j
public class RetryingPaymentGateway implements PaymentGateway {

    private final PaymentGateway delegate;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;
    private final EscrowMetrics metrics;

    public RetryingPaymentGateway(PaymentGateway delegate, Retry retry,
                                  CircuitBreaker circuitBreaker, EscrowMetrics metrics) {
        this.delegate = delegate;
        this.retry = retry;
        this.circuitBreaker = circuitBreaker;
        this.metrics = metrics;
    }

    @Override
    public GatewayOrder createOrder(Money amount, String description, String contractRef) {
        return call("create_order", () -> delegate.createOrder(amount, description, contractRef));
    }

    @Override
    public GatewayCapture captureOrder(String orderId) {
        return call("capture_order", () -> delegate.captureOrder(orderId));
    }

    @Override
    public GatewayRefund refund(String captureId, Money amount) {
        return call("refund", () -> delegate.refund(captureId, amount));
    }

    @Override
    public void verifyWebhook(HttpHeaders headers, byte[] body) {
        call("verify_webhook", () -> {
            delegate.verifyWebhook(headers, body);
            return Boolean.TRUE;
        });
    }

    private <T> T call(String operation, Supplier<T> supplier) {
        long start = System.currentTimeMillis();
        Supplier<T> guarded = CircuitBreaker.decorateSupplier(circuitBreaker, supplier);
        Supplier<T> retrying = Retry.decorateSupplier(retry, guarded);
        try {
            T result = retrying.get();
            metrics.recordGatewayCall(operation, "success", System.currentTimeMillis() - start);
            return result;
        } catch (GatewayRejectedException e) {
            metrics.recordGatewayCall(operation, "rejected", System.currentTimeMillis() - start);
            log.warn("Gateway rejected {}: providerCode={}, message={}",
                    operation, e.getProviderCode(), e.getMessage());
            throw e;
        } catch (GatewayUnavailableException e) {
            metrics.recordGatewayCall(operation, "exhausted", System.currentTimeMillis() - start);
            log.error("Gateway {} still unavailable after retries: {}", operation, e.getMessage());
            throw new PaymentPendingRetryException(
                "Payment gateway unavailable for " + operation + "; try again later", e);
        } catch (CallNotPermittedException e) {
            metrics.recordGatewayCall(operation, "circuit_open", System.currentTimeMillis() - start);
            log.error("Gateway circuit open, {} not attempted", operation);
            throw new PaymentPendingRetryException(
                "Payment gateway temporarily disabled for " + operation + "; try again later", e);
        }
    }
}
