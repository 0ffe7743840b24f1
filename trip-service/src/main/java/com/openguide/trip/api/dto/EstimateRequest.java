package com.openguide.trip.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;

public record EstimateRequest(
        @NotEmpty(message = "Itinerary must contain at least one place")
        @Valid
        List<ItineraryStopRequest> itinerary,

        @NotNull(message = "Start time cannot be null")
        Instant startAt
) {
}
