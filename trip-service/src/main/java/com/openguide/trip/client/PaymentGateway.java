package com.openguide.trip.client;

import com.openguide.common.exception.ServiceUnavailableException;
import com.openguide.trip.client.dto.CheckoutSessionRequest;
import com.openguide.trip.client.dto.CheckoutSessionResult;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Checkout session creation against the payment provider. Retries are safe: the provider deduplicates on the
 * idempotency key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentGateway {

    private final PaymentGatewayClient paymentGatewayClient;

    @Retry(name = "payment")
    @CircuitBreaker(name = "payment", fallbackMethod = "checkoutUnavailable")
    public CheckoutSessionResult createCheckoutSession(String idempotencyKey, CheckoutSessionRequest request) {
        log.info("Creating checkout session {} for {} {}", idempotencyKey, request.amountMinor(), request.currency());
        CheckoutSessionResult result = paymentGatewayClient.createCheckoutSession(idempotencyKey, request);
        if (result == null || result.sessionId() == null) {
            throw new IllegalStateException("Payment provider returned no session id");
        }
        return result;
    }

    private CheckoutSessionResult checkoutUnavailable(String idempotencyKey, CheckoutSessionRequest request, Throwable t) {
        log.error("Payment provider unavailable for checkout {}", idempotencyKey, t);
        throw new ServiceUnavailableException("Payment provider is temporarily unavailable", t);
    }
}
