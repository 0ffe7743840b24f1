package com.openguide.trip.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.openguide.trip.orchestration.PaymentOutcome;
import com.openguide.trip.orchestration.TripOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Handles provider payment deliveries (at-least-once, possibly duplicated or out of order).
 * <p>
 * Only an authenticity failure or a missing webhook secret is reported as an error. Everything after the
 * signature check is acknowledged, whatever the processing outcome, so the provider never retries a
 * delivery that cannot succeed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentConfirmationHandler {

    private final WebhookSignatureVerifier signatureVerifier;
    private final PaymentEventParser eventParser;
    private final PaymentWebhookReceiptService receiptService;
    private final TripOrchestrator tripOrchestrator;

    public PaymentWebhookAck handle(String payload, String signatureHeader) {
        signatureVerifier.verify(payload, signatureHeader);

        PaymentEvent event;
        try {
            event = eventParser.parse(payload);
        } catch (JsonProcessingException e) {
            log.error("Authenticated webhook body is not valid JSON, acknowledged without processing", e);
            return PaymentWebhookAck.of(null, WebhookOutcome.MALFORMED_EVENT);
        }
        log.info("Payment webhook {} received: {}", event.id(), event.type());

        if (!event.isCheckoutCompleted()) {
            log.debug("Ignoring payment event {} of type {}", event.id(), event.type());
            return PaymentWebhookAck.of(event.id(), WebhookOutcome.IGNORED_EVENT_TYPE);
        }
        UUID tripId = parseTripId(event);
        if (tripId == null) {
            return PaymentWebhookAck.of(event.id(), WebhookOutcome.MISSING_TRIP_REFERENCE);
        }

        try {
            if (receiptService.alreadyProcessed(event.id())) {
                log.info("Payment event {} already processed for trip {}", event.id(), tripId);
                return PaymentWebhookAck.of(event.id(), WebhookOutcome.DUPLICATE_EVENT);
            }
            PaymentOutcome outcome = tripOrchestrator.confirmPayment(tripId, event.paymentIntentId());
            WebhookOutcome result = WebhookOutcome.from(outcome);
            if (outcome.isSettled()) {
                receiptService.record(event, tripId, result);
            }
            return PaymentWebhookAck.of(event.id(), result);
        } catch (Exception e) {
            log.error("Payment event {} for trip {} failed during processing; acknowledged, needs manual review",
                    event.id(), tripId, e);
            return PaymentWebhookAck.of(event.id(), WebhookOutcome.PROCESSING_ERROR);
        }
    }

    private static UUID parseTripId(PaymentEvent event) {
        if (event.tripReference() == null) {
            log.error("Payment event {} has no trip reference in its metadata, acknowledged without processing", event.id());
            return null;
        }
        try {
            return UUID.fromString(event.tripReference());
        } catch (IllegalArgumentException e) {
            log.error("Payment event {} carries malformed trip reference '{}', acknowledged without processing",
                    event.id(), event.tripReference());
            return null;
        }
    }
}
