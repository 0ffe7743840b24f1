package com.openguide.trip.orchestration;

/**
 * Result of applying a payment confirmation. Every outcome is acknowledged to the provider.
 */
public enum PaymentOutcome {
    CONFIRMED,
    ALREADY_PAID,
    TRIP_NOT_FOUND,
    INVALID_TRANSITION,
    CONCURRENT_UPDATE;

    /** The event settled the trip, so a redelivery of it can be short-circuited. */
    public boolean isSettled() {
        return this == CONFIRMED || this == ALREADY_PAID;
    }
}
