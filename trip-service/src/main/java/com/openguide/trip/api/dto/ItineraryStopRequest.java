package com.openguide.trip.api.dto;

import com.openguide.trip.domain.model.ItineraryStop;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record ItineraryStopRequest(
        @NotNull(message = "Place ID cannot be null")
        Long placeId,

        @NotNull(message = "Visit duration cannot be null")
        @Positive(message = "Visit duration must be positive")
        Integer visitDurationMinutes,

        @Size(max = 500)
        String notes,

        Boolean ticketRequired
) {
    public ItineraryStop toStop() {
        return ItineraryStop.builder()
                .placeId(placeId)
                .visitDurationMinutes(visitDurationMinutes)
                .notes(notes)
                .ticketRequired(Boolean.TRUE.equals(ticketRequired))
                .build();
    }
}
