package com.openguide.trip.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Lifecycle states of a trip. Wire values are snake_case.
 */
public enum TripStatus {
    DRAFT("draft"),
    SELECTING_GUIDE("selecting_guide"),
    AWAITING_CALL("awaiting_call"),
    IN_CALL("in_call"),
    PENDING_CONFIRMATION("pending_confirmation"),
    AWAITING_PAYMENT("awaiting_payment"),
    CONFIRMED("confirmed"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    CANCELLED("cancelled"),
    REJECTED("rejected"),
    ARCHIVED("archived");

    private final String value;

    TripStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TripStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown trip status: " + value));
    }
}
