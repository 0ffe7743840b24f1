package com.openguide.trip.domain.service;

import java.time.Instant;

public record TripEstimate(
        int totalVisitMinutes,
        int travelEstimateMinutes,
        int totalMinutes,
        Instant endAt
) {
}
