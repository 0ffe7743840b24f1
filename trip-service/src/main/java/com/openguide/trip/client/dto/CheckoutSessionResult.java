package com.openguide.trip.client.dto;

public record CheckoutSessionResult(
        String sessionId,
        String checkoutUrl
) {
}
