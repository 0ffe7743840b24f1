package com.openguide.trip.domain.repository;

import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.model.TripStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TripRepository extends JpaRepository<Trip, UUID> {

    /**
     * Status compare-and-swap: moves the trip to {@code next} only when its stored status is still {@code expected}.
     * Returns the number of rows changed (0 or 1).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Trip t
            SET t.status = :next, t.updatedAt = :now
            WHERE t.id = :id AND t.status = :expected
            """)
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("expected") TripStatus expected,
                            @Param("next") TripStatus next,
                            @Param("now") Instant now);

    /** Trips of the guide in the given statuses whose interval intersects [startAt, endAt). */
    @Query("""
            SELECT t FROM Trip t
            WHERE t.selectedGuideId = :guideId
              AND t.status IN :statuses
              AND t.startAt < :endAt
              AND t.endAt > :startAt
            """)
    List<Trip> findOverlapping(@Param("guideId") Long guideId,
                               @Param("startAt") Instant startAt,
                               @Param("endAt") Instant endAt,
                               @Param("statuses") Collection<TripStatus> statuses);

    Optional<Trip> findFirstBySourceCallIdAndTouristIdAndStartAtGreaterThanEqualAndStartAtLessThan(
            UUID sourceCallId, Long touristId, Instant dayStart, Instant dayEnd);

    List<Trip> findByTouristIdOrderByCreatedAtDesc(Long touristId);

    List<Trip> findBySelectedGuideIdOrderByStartAtDesc(Long guideId);
}
