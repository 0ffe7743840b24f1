package com.openguide.trip.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One stop of an itinerary: a place, how long to stay, and whether its ticket is part of the price.
 */
@Embeddable
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItineraryStop {

    @Column(name = "place_id", nullable = false)
    private Long placeId;

    @Column(name = "visit_duration_minutes", nullable = false)
    private Integer visitDurationMinutes;

    @Column(name = "notes", length = 500)
    private String notes;

    @Column(name = "ticket_required", nullable = false)
    private boolean ticketRequired;

    public ItineraryStop copy() {
        return new ItineraryStop(placeId, visitDurationMinutes, notes, ticketRequired);
    }
}
