package com.openguide.trip.api.dto;

public record CallInitiationResponse(
        TripResponse trip,
        CallJoinResponse call
) {
}
