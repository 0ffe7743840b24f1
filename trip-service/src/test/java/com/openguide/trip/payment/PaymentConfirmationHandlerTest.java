package com.openguide.trip.payment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openguide.trip.orchestration.PaymentOutcome;
import com.openguide.trip.orchestration.TripOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentConfirmationHandlerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final UUID TRIP_ID = UUID.fromString("6f1c2b7e-9a1d-4f3e-8b2a-0c5d7e9f1a2b");

    @Mock
    private PaymentWebhookReceiptService receiptService;
    @Mock
    private TripOrchestrator tripOrchestrator;

    private WebhookSignatureVerifier verifier;
    private PaymentConfirmationHandler handler;

    @BeforeEach
    void setUp() {
        verifier = new WebhookSignatureVerifier("whsec_test", 300, Clock.fixed(NOW, ZoneOffset.UTC));
        handler = new PaymentConfirmationHandler(verifier, new PaymentEventParser(new ObjectMapper()),
                receiptService, tripOrchestrator);
    }

    @Test
    @DisplayName("Checkout completion confirms the trip and stores a receipt")
    void confirmsTrip() {
        // given
        String payload = checkoutCompleted("evt_1", TRIP_ID.toString());
        when(receiptService.alreadyProcessed("evt_1")).thenReturn(false);
        when(tripOrchestrator.confirmPayment(TRIP_ID, "pi_1")).thenReturn(PaymentOutcome.CONFIRMED);

        // when
        PaymentWebhookAck ack = handler.handle(payload, signed(payload));

        // then
        assertThat(ack.received()).isTrue();
        assertThat(ack.eventId()).isEqualTo("evt_1");
        assertThat(ack.outcome()).isEqualTo(WebhookOutcome.CONFIRMED);
        ArgumentCaptor<PaymentEvent> event = ArgumentCaptor.forClass(PaymentEvent.class);
        verify(receiptService).record(event.capture(), eq(TRIP_ID), eq(WebhookOutcome.CONFIRMED));
        assertThat(event.getValue().sessionId()).isEqualTo("cs_1");
    }

    @Test
    @DisplayName("Redelivered event is acknowledged as a duplicate without touching the trip again")
    void duplicateDelivery() {
        // given
        String payload = checkoutCompleted("evt_1", TRIP_ID.toString());
        when(receiptService.alreadyProcessed("evt_1")).thenReturn(false, true);
        when(tripOrchestrator.confirmPayment(TRIP_ID, "pi_1")).thenReturn(PaymentOutcome.CONFIRMED);

        // when
        PaymentWebhookAck first = handler.handle(payload, signed(payload));
        PaymentWebhookAck second = handler.handle(payload, signed(payload));

        // then
        assertThat(first.outcome()).isEqualTo(WebhookOutcome.CONFIRMED);
        assertThat(second.outcome()).isEqualTo(WebhookOutcome.DUPLICATE_EVENT);
        verify(tripOrchestrator, times(1)).confirmPayment(TRIP_ID, "pi_1");
    }

    @Test
    @DisplayName("Bad signature is an error and nothing is processed")
    void badSignature() {
        String payload = checkoutCompleted("evt_1", TRIP_ID.toString());

        assertThatThrownBy(() -> handler.handle(payload, "t=" + NOW.getEpochSecond() + ",v1=00ff"))
                .isInstanceOf(WebhookSignatureException.class);
        verifyNoInteractions(receiptService, tripOrchestrator);
    }

    @Test
    @DisplayName("Missing or malformed trip reference is acknowledged without processing")
    void missingTripReference() {
        String withoutTrip = checkoutCompleted("evt_2", null);
        String malformedTrip = checkoutCompleted("evt_3", "not-a-uuid");

        assertThat(handler.handle(withoutTrip, signed(withoutTrip)).outcome())
                .isEqualTo(WebhookOutcome.MISSING_TRIP_REFERENCE);
        assertThat(handler.handle(malformedTrip, signed(malformedTrip)).outcome())
                .isEqualTo(WebhookOutcome.MISSING_TRIP_REFERENCE);
        verifyNoInteractions(tripOrchestrator);
    }

    @Test
    @DisplayName("Other event types are acknowledged and ignored")
    void otherEventType() {
        String payload = "{\"id\":\"evt_4\",\"type\":\"charge.refunded\",\"data\":{\"object\":{\"id\":\"ch_1\"}}}";

        PaymentWebhookAck ack = handler.handle(payload, signed(payload));

        assertThat(ack.outcome()).isEqualTo(WebhookOutcome.IGNORED_EVENT_TYPE);
        verifyNoInteractions(receiptService, tripOrchestrator);
    }

    @Test
    @DisplayName("Authenticated garbage is acknowledged as malformed")
    void malformedBody() {
        String payload = "{not json";

        assertThat(handler.handle(payload, signed(payload)).outcome()).isEqualTo(WebhookOutcome.MALFORMED_EVENT);
    }

    @Test
    @DisplayName("Payment for a cancelled trip is acknowledged but leaves no receipt")
    void cancelledTrip() {
        // given
        String payload = checkoutCompleted("evt_5", TRIP_ID.toString());
        when(receiptService.alreadyProcessed("evt_5")).thenReturn(false);
        when(tripOrchestrator.confirmPayment(TRIP_ID, "pi_1")).thenReturn(PaymentOutcome.INVALID_TRANSITION);

        // when
        PaymentWebhookAck ack = handler.handle(payload, signed(payload));

        // then
        assertThat(ack.outcome()).isEqualTo(WebhookOutcome.INVALID_TRANSITION);
        verify(receiptService, never()).record(any(), any(), any());
    }

    @Test
    @DisplayName("Unexpected failure while confirming is acknowledged as a processing error")
    void processingError() {
        String payload = checkoutCompleted("evt_6", TRIP_ID.toString());
        when(receiptService.alreadyProcessed("evt_6")).thenReturn(false);
        when(tripOrchestrator.confirmPayment(TRIP_ID, "pi_1")).thenThrow(new IllegalStateException("db down"));

        assertThat(handler.handle(payload, signed(payload)).outcome()).isEqualTo(WebhookOutcome.PROCESSING_ERROR);
    }

    private String signed(String payload) {
        return verifier.sign(payload, NOW.getEpochSecond());
    }

    private static String checkoutCompleted(String eventId, String tripId) {
        String metadata = tripId == null ? "{}" : "{\"tripId\":\"" + tripId + "\"}";
        return "{\"id\":\"" + eventId + "\",\"type\":\"checkout.session.completed\",\"data\":{\"object\":"
                + "{\"id\":\"cs_1\",\"payment_intent\":\"pi_1\",\"metadata\":" + metadata + "}}}";
    }
}
