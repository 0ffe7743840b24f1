package com.openguide.trip.api.dto;

import jakarta.validation.constraints.Size;

public record RejectTripRequest(
        @Size(max = 1000)
        String reason
) {
}
