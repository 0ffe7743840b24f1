package com.openguide.trip.domain.store;

import com.openguide.common.exception.ResourceNotFoundException;
import com.openguide.common.exception.ValidationException;
import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.model.TripStatus;
import com.openguide.trip.domain.repository.TripRepository;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * {@link TripStore} over JPA. The status check and status write happen in a single conditional UPDATE, so
 * the database row lock orders concurrent writers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaTripStore implements TripStore {

    private final TripRepository tripRepository;
    private final Clock clock;

    @Override
    @Transactional
    public Trip create(Trip trip) {
        Instant now = clock.instant();
        if (trip.getCreatedAt() == null) {
            trip.setCreatedAt(now);
        }
        trip.setUpdatedAt(now);
        try {
            return tripRepository.saveAndFlush(trip);
        } catch (ConstraintViolationException e) {
            throw new ValidationException(describe(e));
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Trip> findById(UUID tripId) {
        return tripRepository.findById(tripId);
    }

    @Override
    @Transactional
    public UpdateResult updateIfStatus(UUID tripId, TripStatus expectedStatus, TripPatch patch) {
        TripStatus next = patch.resolveStatus(expectedStatus);
        Instant now = clock.instant();
        int rows = tripRepository.compareAndSetStatus(tripId, expectedStatus, next, now);
        Trip current = tripRepository.findById(tripId)
                .orElseThrow(() -> new ResourceNotFoundException("Trip", tripId));
        if (rows == 0) {
            log.warn("Conditional update lost for trip {}: expected {}, found {}", tripId, expectedStatus, current.getStatus());
            return UpdateResult.rejected(current);
        }
        patch.applyTo(current);
        current.setUpdatedAt(now);
        try {
            Trip saved = tripRepository.saveAndFlush(current);
            if (next != expectedStatus) {
                log.info("Trip {} moved {} -> {}", tripId, expectedStatus.getValue(), next.getValue());
            }
            return UpdateResult.applied(saved);
        } catch (ConstraintViolationException e) {
            throw new ValidationException(describe(e));
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Trip> findOverlapping(Long guideId, Instant startAt, Instant endAt, Collection<TripStatus> statuses) {
        return tripRepository.findOverlapping(guideId, startAt, endAt, statuses);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Trip> findDuplicate(UUID sourceCallId, Long touristId, Instant dayStart, Instant dayEnd) {
        return tripRepository.findFirstBySourceCallIdAndTouristIdAndStartAtGreaterThanEqualAndStartAtLessThan(
                sourceCallId, touristId, dayStart, dayEnd);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Trip> findByTourist(Long touristId) {
        return tripRepository.findByTouristIdOrderByCreatedAtDesc(touristId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Trip> findByGuide(Long guideId) {
        return tripRepository.findBySelectedGuideIdOrderByStartAtDesc(guideId);
    }

    private static String describe(ConstraintViolationException e) {
        return e.getConstraintViolations().stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .collect(Collectors.joining(", "));
    }
}
