package com.openguide.trip.domain.store;

import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.model.TripStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Changes applied to a trip after its status compare-and-swap succeeds.
 * <p>
 * A patch either moves the trip to a target status or keeps the current one; field mutations run
 * against the freshly reloaded trip, never against the caller's stale copy.
 */
public final class TripPatch {

    private final TripStatus targetStatus;
    private final List<Consumer<Trip>> mutations = new ArrayList<>();

    private TripPatch(TripStatus targetStatus) {
        this.targetStatus = targetStatus;
    }

    public static TripPatch transitionTo(TripStatus targetStatus) {
        if (targetStatus == null) {
            throw new IllegalArgumentException("targetStatus must not be null");
        }
        return new TripPatch(targetStatus);
    }

    /** Field-only write, still guarded by the expected status. */
    public static TripPatch keepStatus() {
        return new TripPatch(null);
    }

    public TripPatch with(Consumer<Trip> mutation) {
        mutations.add(mutation);
        return this;
    }

    public TripStatus resolveStatus(TripStatus current) {
        return targetStatus != null ? targetStatus : current;
    }

    public void applyTo(Trip trip) {
        mutations.forEach(mutation -> mutation.accept(trip));
        if (targetStatus != null) {
            trip.setStatus(targetStatus);
        }
    }
}
