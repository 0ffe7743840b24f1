package com.openguide.trip.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who acted on a trip. Recorded as {@code cancelledBy} on cancellation and rejection.
 */
public enum TripActor {
    TOURIST,
    GUIDE,
    ADMIN;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static TripActor fromValue(String value) {
        return TripActor.valueOf(value.trim().toUpperCase());
    }
}
