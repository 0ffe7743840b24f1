package com.openguide.trip.payment;

public record PaymentWebhookAck(
        boolean received,
        String eventId,
        WebhookOutcome outcome
) {
    public static PaymentWebhookAck of(String eventId, WebhookOutcome outcome) {
        return new PaymentWebhookAck(true, eventId, outcome);
    }
}
