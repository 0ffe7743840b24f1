package com.openguide.trip.api.dto;

import com.openguide.trip.domain.model.TripActor;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CancelTripRequest(
        @Size(max = 1000)
        String reason,

        @NotNull(message = "Actor role cannot be null")
        TripActor role
) {
}
