package com.openguide.trip.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Either {@code provinceId} or {@code createdFromPlaceId} must resolve to a province.
 */
public record CreateTripRequest(
        @NotNull(message = "Start time cannot be null")
        Instant startAt,

        @Positive(message = "Duration must be positive")
        Integer totalDurationMinutes,

        @Valid
        List<ItineraryStopRequest> itinerary,

        Long provinceId,

        Long createdFromPlaceId,

        UUID sourceCallId,

        @Valid
        MeetingPointRequest meetingPoint,

        @Size(max = 500)
        String meetingAddress,

        @Size(max = 2000)
        String notes
) {
}
