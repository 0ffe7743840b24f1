package com.openguide.trip.api.dto;

import jakarta.validation.constraints.NotNull;

public record SelectGuideRequest(
        @NotNull(message = "Guide ID cannot be null")
        Long guideId
) {
}
