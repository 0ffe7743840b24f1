package com.openguide.trip.orchestration;

import com.openguide.common.exception.BusinessRuleViolationException;
import com.openguide.common.exception.ConflictException;
import com.openguide.common.exception.ForbiddenException;
import com.openguide.common.exception.ResourceNotFoundException;
import com.openguide.trip.client.DirectoryGateway;
import com.openguide.trip.client.dto.GuideView;
import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.model.TripStatus;
import com.openguide.trip.domain.store.TripPatch;
import com.openguide.trip.domain.store.TripStore;
import com.openguide.trip.domain.store.UpdateResult;
import com.openguide.trip.events.TripEventOutbox;
import com.openguide.trip.events.TripNotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Load, authorize and conditional-write steps shared by the trip operations.
 */
@Slf4j
@Component
@RequiredArgsConstructor
class TripAccess {

    /** Statuses that block a guide's calendar. */
    static final Set<TripStatus> ACTIVE_STATUSES = EnumSet.of(TripStatus.CONFIRMED, TripStatus.IN_PROGRESS);

    private final TripStore tripStore;
    private final DirectoryGateway directoryGateway;
    private final TripEventOutbox outbox;

    Trip load(UUID tripId) {
        return tripStore.findById(tripId).orElseThrow(() -> new ResourceNotFoundException("Trip", tripId));
    }

    void requireTourist(Trip trip, Long touristId, String action) {
        if (touristId == null || !touristId.equals(trip.getTouristId())) {
            throw new ForbiddenException("Only the trip's tourist can " + action);
        }
    }

    void requireAssignedGuide(Trip trip, Long guideId, String action) {
        if (guideId == null || !guideId.equals(trip.getSelectedGuideId())) {
            throw new ForbiddenException("Only the trip's assigned guide can " + action);
        }
    }

    /**
     * CAS on the status the caller validated against. A lost race is a {@link ConflictException}: the caller must
     * reload, never merge.
     */
    Trip writeOrConflict(Trip preImage, TripPatch patch, String conflictMessage) {
        UpdateResult result = tripStore.updateIfStatus(preImage.getId(), preImage.getStatus(), patch);
        if (!result.updated()) {
            log.warn("Trip {} changed concurrently ({} -> {}), rejecting write",
                    preImage.getId(), preImage.getStatus().getValue(), result.trip().getStatus().getValue());
            throw new ConflictException(conflictMessage);
        }
        return result.trip();
    }

    void ensureGuideAvailable(Long guideId, UUID tripId, Instant startAt, Instant endAt) {
        List<Trip> overlapping = tripStore.findOverlapping(guideId, startAt, endAt, ACTIVE_STATUSES).stream()
                .filter(other -> !other.getId().equals(tripId))
                .toList();
        if (!overlapping.isEmpty()) {
            log.info("Guide {} unavailable for trip {}: overlaps {}", guideId, tripId, overlapping.get(0).getId());
            throw new BusinessRuleViolationException("Guide already has a trip in this time slot", "GUIDE_UNAVAILABLE");
        }
    }

    /** Notifies a guide by profile id; the user id is looked up and a failed lookup only skips the notification. */
    void notifyGuide(Trip trip, Long guideId, TripNotificationType type, Map<String, Object> payload) {
        if (guideId == null) return;
        Optional<GuideView> guide;
        try {
            guide = directoryGateway.findGuide(guideId);
        } catch (Exception e) {
            log.warn("Could not resolve guide {} for {} notification on trip {} (non-fatal)", guideId, type, trip.getId(), e);
            return;
        }
        guide.ifPresentOrElse(
                g -> outbox.notify(trip, type, g.userId(), payload),
                () -> log.warn("Guide {} not found, {} notification for trip {} skipped", guideId, type, trip.getId()));
    }
}
