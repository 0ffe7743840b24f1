package com.openguide.trip.domain.store;

import com.openguide.trip.domain.model.Trip;

/**
 * Outcome of a conditional update. When {@code updated} is false, {@code trip} is the current stored state.
 */
public record UpdateResult(boolean updated, Trip trip) {

    public static UpdateResult applied(Trip trip) {
        return new UpdateResult(true, trip);
    }

    public static UpdateResult rejected(Trip current) {
        return new UpdateResult(false, current);
    }
}
