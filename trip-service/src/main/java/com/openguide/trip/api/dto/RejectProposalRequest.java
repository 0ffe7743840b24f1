package com.openguide.trip.api.dto;

import jakarta.validation.constraints.Size;

public record RejectProposalRequest(
        @Size(max = 2000)
        String note
) {
}
