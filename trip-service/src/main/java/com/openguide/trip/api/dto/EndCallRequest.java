package com.openguide.trip.api.dto;

import com.openguide.trip.domain.model.CallEndReason;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * All fields optional; the reason defaults to completed.
 */
public record EndCallRequest(
        CallEndReason endReason,

        @Size(max = 2000)
        String summary,

        BigDecimal negotiatedPrice
) {
}
