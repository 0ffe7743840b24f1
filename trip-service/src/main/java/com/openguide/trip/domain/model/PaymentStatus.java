package com.openguide.trip.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentStatus {
    UNPAID,
    PENDING,
    PAID,
    REFUNDED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
