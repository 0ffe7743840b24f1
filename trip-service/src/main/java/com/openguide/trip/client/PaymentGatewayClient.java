package com.openguide.trip.client;

import com.openguide.trip.client.dto.CheckoutSessionRequest;
import com.openguide.trip.client.dto.CheckoutSessionResult;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;

/**
 * Feign client for the hosted-checkout payment provider. Completion arrives later through the webhook.
 */
@FeignClient(name = "payment-gateway", url = "${trip.payment.gateway-url:}", path = "/v1")
public interface PaymentGatewayClient {

    @PostMapping("/checkout/sessions")
    CheckoutSessionResult createCheckoutSession(@RequestHeader("Idempotency-Key") String idempotencyKey,
                                                @RequestBody CheckoutSessionRequest request);
}
