package com.openguide.trip.client.dto;

import java.util.Map;

/**
 * Amount is in minor units (cents) and always computed server-side from the trip's negotiated price.
 */
public record CheckoutSessionRequest(
        long amountMinor,
        String currency,
        String description,
        String customerReference,
        Map<String, String> metadata
) {
}
