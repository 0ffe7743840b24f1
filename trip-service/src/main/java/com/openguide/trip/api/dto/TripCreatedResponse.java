package com.openguide.trip.api.dto;

public record TripCreatedResponse(
        TripResponse trip,
        CandidateGuidesResponse candidateGuides
) {
}
