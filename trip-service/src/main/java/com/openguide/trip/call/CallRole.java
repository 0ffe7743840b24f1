package com.openguide.trip.call;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CallRole {
    TOURIST,
    GUIDE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
