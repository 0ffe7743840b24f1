package com.openguide.trip.domain.service;

import com.openguide.trip.client.dto.GuideView;

/**
 * A guide offered for a trip; {@code distanceKm} is null when the trip has no meeting point.
 */
public record CandidateGuide(GuideView guide, Double distanceKm) {
}
