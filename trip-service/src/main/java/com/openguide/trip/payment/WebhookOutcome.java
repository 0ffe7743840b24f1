package com.openguide.trip.payment;

import com.fasterxml.jackson.annotation.JsonValue;
import com.openguide.trip.orchestration.PaymentOutcome;

/**
 * What happened to a delivery. Every outcome is acknowledged to the provider.
 */
public enum WebhookOutcome {
    CONFIRMED,
    ALREADY_PAID,
    DUPLICATE_EVENT,
    IGNORED_EVENT_TYPE,
    MISSING_TRIP_REFERENCE,
    TRIP_NOT_FOUND,
    INVALID_TRANSITION,
    CONCURRENT_UPDATE,
    MALFORMED_EVENT,
    PROCESSING_ERROR;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    public static WebhookOutcome from(PaymentOutcome outcome) {
        return switch (outcome) {
            case CONFIRMED -> CONFIRMED;
            case ALREADY_PAID -> ALREADY_PAID;
            case TRIP_NOT_FOUND -> TRIP_NOT_FOUND;
            case INVALID_TRANSITION -> INVALID_TRANSITION;
            case CONCURRENT_UPDATE -> CONCURRENT_UPDATE;
        };
    }
}
