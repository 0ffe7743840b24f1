package com.openguide.trip.orchestration;

import com.openguide.trip.call.CallJoin;
import com.openguide.trip.domain.model.Trip;

public record CallInitiation(Trip trip, CallJoin join) {
}
