package com.openguide.trip.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;

public record ProposeChangeRequest(
        @Valid
        List<ItineraryStopRequest> itinerary,

        Instant startAt,

        @Size(max = 2000)
        String note
) {
}
