package com.openguide.trip.domain.service;

import com.openguide.common.exception.ResourceNotFoundException;
import com.openguide.trip.client.DirectoryGateway;
import com.openguide.trip.client.dto.GuideView;
import com.openguide.trip.domain.model.GeoPoint;
import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.model.TripStatus;
import com.openguide.trip.domain.store.TripPatch;
import com.openguide.trip.domain.store.TripStore;
import com.openguide.trip.domain.store.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Guides a tourist can pick for a trip: active guides of the trip's province, optionally by language and
 * distance from the meeting point, best rated first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateGuideService {

    /** Flat-degree approximation, not great-circle. */
    static final double KM_PER_DEGREE = 111.0;

    private static final Set<TripStatus> SELECTABLE = EnumSet.of(TripStatus.SELECTING_GUIDE, TripStatus.AWAITING_CALL);

    private final TripStore tripStore;
    private final DirectoryGateway directoryGateway;

    @Value("${trip.candidates.max-distance-km:50}")
    private double defaultMaxDistanceKm;

    /**
     * Empty (never an error) once the trip has left guide selection, so stale polling clients get nothing.
     * <p>
     * Not transactional: the candidate cache write commits or rolls back on its own, so a failed write never
     * fails the listing.
     */
    public CandidateGuidesPage listCandidateGuides(UUID tripId, CandidateFilter filter) {
        Trip trip = tripStore.findById(tripId).orElseThrow(() -> new ResourceNotFoundException("Trip", tripId));
        if (!SELECTABLE.contains(trip.getStatus())) {
            log.debug("Trip {} is {}, no candidate guides", tripId, trip.getStatus().getValue());
            return CandidateGuidesPage.empty(filter);
        }
        CandidateSearch search = search(trip, filter);
        cacheCandidates(trip, search.candidateGuideIds());
        return search.page();
    }

    /**
     * Ranks the province's active guides for {@code trip} without writing anything. Callers that write the trip
     * themselves store {@link CandidateSearch#candidateGuideIds()} as part of that write.
     */
    public CandidateSearch search(Trip trip, CandidateFilter filter) {
        List<GuideView> provinceGuides = directoryGateway.findActiveGuides(trip.getProvinceId(), filter.language()).stream()
                .filter(GuideView::active)
                .sorted(Comparator.comparingDouble(GuideView::ratingOrZero).reversed())
                .toList();

        GeoPoint meetingPoint = trip.getMeetingPoint();
        double maxDistance = filter.maxDistanceKm() != null ? filter.maxDistanceKm() : defaultMaxDistanceKm;
        List<CandidateGuide> eligible = provinceGuides.stream()
                .map(guide -> new CandidateGuide(guide, distanceFromMeetingPoint(meetingPoint, guide)))
                .filter(candidate -> meetingPoint == null
                        || (candidate.distanceKm() != null && candidate.distanceKm() <= maxDistance))
                .toList();

        int page = filter.effectivePage();
        int limit = filter.effectiveLimit();
        int from = (int) Math.min((long) (page - 1) * limit, eligible.size());
        int to = Math.min(from + limit, eligible.size());
        return new CandidateSearch(provinceGuides.stream().map(GuideView::id).toList(),
                new CandidateGuidesPage(eligible.subList(from, to), page, limit, eligible.size()));
    }

    static double approximateDistanceKm(GeoPoint a, GeoPoint b) {
        double dLat = a.getLatitude() - b.getLatitude();
        double dLng = a.getLongitude() - b.getLongitude();
        return Math.sqrt(dLat * dLat + dLng * dLng) * KM_PER_DEGREE;
    }

    private static Double distanceFromMeetingPoint(GeoPoint meetingPoint, GuideView guide) {
        GeoPoint location = guide.location();
        if (meetingPoint == null || location == null) {
            return null;
        }
        return approximateDistanceKm(meetingPoint, location);
    }

    private void cacheCandidates(Trip trip, List<Long> guideIds) {
        try {
            UpdateResult result = tripStore.updateIfStatus(trip.getId(), trip.getStatus(),
                    TripPatch.keepStatus().with(t -> t.replaceCandidateGuides(guideIds)));
            if (!result.updated()) {
                log.debug("Candidate cache for trip {} skipped: status moved to {}", trip.getId(), result.trip().getStatus());
            }
        } catch (Exception e) {
            log.warn("Failed to cache candidate guides for trip {} (non-fatal)", trip.getId(), e);
        }
    }
}
