package com.openguide.trip.api.dto;

import com.openguide.trip.domain.service.TripEstimate;

import java.time.Instant;

public record TripEstimateResponse(
        int totalVisitMinutes,
        int travelEstimateMinutes,
        int totalMinutes,
        Instant endAt
) {
    public static TripEstimateResponse from(TripEstimate estimate) {
        return new TripEstimateResponse(estimate.totalVisitMinutes(), estimate.travelEstimateMinutes(),
                estimate.totalMinutes(), estimate.endAt());
    }
}
