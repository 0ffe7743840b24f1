package com.openguide.trip.api.controller;

import com.openguide.trip.payment.PaymentConfirmationHandler;
import com.openguide.trip.payment.PaymentWebhookAck;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Provider webhook. The raw body is taken as a string so the signature is checked over the exact bytes sent.
 */
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentWebhookController {

    static final String SIGNATURE_HEADER = "Stripe-Signature";

    private final PaymentConfirmationHandler confirmationHandler;

    @PostMapping("/webhook")
    public ResponseEntity<PaymentWebhookAck> handleWebhook(
            @RequestBody String payload,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {
        return ResponseEntity.ok(confirmationHandler.handle(payload, signature));
    }
}
