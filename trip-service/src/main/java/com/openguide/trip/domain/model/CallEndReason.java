package com.openguide.trip.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CallEndReason {
    COMPLETED,
    TIMEOUT,
    CANCELLED,
    NO_ANSWER,
    TECHNICAL_ISSUE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static CallEndReason fromValue(String value) {
        return CallEndReason.valueOf(value.trim().toUpperCase());
    }
}
