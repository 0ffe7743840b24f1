package com.openguide.trip.events;

/**
 * Notification kinds sent to trip parties. The wire name is the lowercase constant.
 */
public enum TripNotificationType {
    GUIDE_SELECTED,
    GUIDE_DESELECTED,
    INCOMING_CALL,
    CALL_ENDED,
    PAYMENT_REQUIRED,
    TRIP_REJECTED,
    TRIP_CANCELLED,
    PAYMENT_CONFIRMED,
    TRIP_CONFIRMED,
    TRIP_STARTED,
    TRIP_COMPLETED,
    PROPOSAL_RECEIVED,
    PROPOSAL_ACCEPTED,
    PROPOSAL_REJECTED;

    public String wireName() {
        return name().toLowerCase();
    }
}
