package com.openguide.trip.api.dto;

import java.math.BigDecimal;

public record CheckoutSessionResponse(
        String sessionId,
        String checkoutUrl,
        BigDecimal amount,
        String currency
) {
}
