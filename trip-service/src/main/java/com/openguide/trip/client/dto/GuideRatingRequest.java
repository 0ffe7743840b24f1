package com.openguide.trip.client.dto;

import java.util.UUID;

public record GuideRatingRequest(
        UUID tripId,
        int rating
) {
}
