package com.openguide.trip.orchestration;

import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.service.CandidateGuidesPage;

public record TripCreation(Trip trip, CandidateGuidesPage candidates) {
}
