package com.openguide.trip.domain.store;

import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.model.TripStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence of trips. The only way to change a stored trip is {@link #updateIfStatus}.
 */
public interface TripStore {

    Trip create(Trip trip);

    Optional<Trip> findById(UUID tripId);

    /**
     * Applies {@code patch} only if the stored status still equals {@code expectedStatus}. Of two callers racing
     * on the same expected status at most one sees {@code updated=true}.
     *
     * @throws com.openguide.common.exception.ResourceNotFoundException if the trip does not exist
     * @throws com.openguide.common.exception.ValidationException if the patched trip breaks a schema constraint
     */
    UpdateResult updateIfStatus(UUID tripId, TripStatus expectedStatus, TripPatch patch);

    /** Trips of {@code guideId} in one of {@code statuses} whose interval intersects [startAt, endAt). */
    List<Trip> findOverlapping(Long guideId, Instant startAt, Instant endAt, Collection<TripStatus> statuses);

    Optional<Trip> findDuplicate(UUID sourceCallId, Long touristId, Instant dayStart, Instant dayEnd);

    List<Trip> findByTourist(Long touristId);

    List<Trip> findByGuide(Long guideId);
}
