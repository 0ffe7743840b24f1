package com.openguide.trip.orchestration;

import com.openguide.common.exception.ForbiddenException;
import com.openguide.trip.api.dto.ItineraryStopRequest;
import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.service.PricingService;
import com.openguide.trip.domain.service.TripEstimate;
import com.openguide.trip.domain.store.TripStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class TripQueryService {

    private final TripAccess access;
    private final TripStore tripStore;
    private final PricingService pricingService;

    /**
     * Visible to the trip's tourist (by user id) and its assigned guide (by guide id).
     */
    @Transactional(readOnly = true)
    public Trip getTrip(UUID tripId, Long userId, Long guideId) {
        Trip trip = access.load(tripId);
        requireParty(trip, userId, guideId);
        return trip;
    }

    @Transactional(readOnly = true)
    public List<Trip> findByTourist(Long touristId) {
        return tripStore.findByTourist(touristId);
    }

    @Transactional(readOnly = true)
    public List<Trip> findByGuide(Long guideId) {
        return tripStore.findByGuide(guideId);
    }

    public TripEstimate estimate(List<ItineraryStopRequest> itinerary, Instant startAt) {
        return pricingService.estimate(itinerary == null ? List.of()
                : itinerary.stream().map(ItineraryStopRequest::toStop).toList(), startAt);
    }

    void requireParty(Trip trip, Long userId, Long guideId) {
        boolean tourist = userId != null && userId.equals(trip.getTouristId());
        boolean guide = guideId != null && guideId.equals(trip.getSelectedGuideId());
        if (!tourist && !guide) {
            throw new ForbiddenException("Only the trip's tourist or assigned guide can view it");
        }
    }
}
