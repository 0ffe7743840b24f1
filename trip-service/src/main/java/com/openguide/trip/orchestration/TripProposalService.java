package com.openguide.trip.orchestration;

import com.openguide.common.exception.BusinessRuleViolationException;
import com.openguide.common.exception.ResourceNotFoundException;
import com.openguide.common.exception.ValidationException;
import com.openguide.trip.api.dto.ItineraryStopRequest;
import com.openguide.trip.api.dto.ProposeChangeRequest;
import com.openguide.trip.client.DirectoryGateway;
import com.openguide.trip.client.dto.GuideView;
import com.openguide.trip.domain.model.ItineraryStop;
import com.openguide.trip.domain.model.PriceBreakdown;
import com.openguide.trip.domain.model.ProposalStatus;
import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.model.TripProposal;
import com.openguide.trip.domain.model.TripReview;
import com.openguide.trip.domain.model.TripStatus;
import com.openguide.trip.domain.repository.TripProposalRepository;
import com.openguide.trip.domain.service.PricingService;
import com.openguide.trip.domain.service.TripEstimate;
import com.openguide.trip.domain.store.TripPatch;
import com.openguide.trip.events.TripEventOutbox;
import com.openguide.trip.events.TripNotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.openguide.trip.orchestration.TripOrchestrator.details;

/**
 * Post-confirmation flows: the tourist's review and the guide's change proposals. The trip stays in its
 * status throughout; every write is still guarded by that status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TripProposalService {

    private static final String CONFLICT_MESSAGE = "Trip was updated by another request. Please refresh and try again.";

    private final TripAccess access;
    private final TripProposalRepository proposalRepository;
    private final PricingService pricingService;
    private final DirectoryGateway directoryGateway;
    private final TripEventOutbox outbox;
    private final Clock clock;

    @Transactional
    public Trip reviewTrip(Long touristId, UUID tripId, int rating, String comment) {
        if (rating < 1 || rating > 5) {
            throw new ValidationException("Rating must be between 1 and 5");
        }
        Trip trip = access.load(tripId);
        access.requireTourist(trip, touristId, "review it");
        if (trip.getStatus() != TripStatus.COMPLETED) {
            throw new BusinessRuleViolationException("Only completed trips can be reviewed", "TRIP_NOT_COMPLETED");
        }
        if (trip.hasReview()) {
            throw new BusinessRuleViolationException("Trip has already been reviewed", "ALREADY_REVIEWED");
        }
        TripReview review = TripReview.builder()
                .rating(rating)
                .comment(comment)
                .reviewedAt(clock.instant())
                .build();

        Trip updated = access.writeOrConflict(trip, TripPatch.keepStatus().with(t -> t.setReview(review)), CONFLICT_MESSAGE);

        if (updated.getSelectedGuideId() != null) {
            outbox.guideRated(updated.getSelectedGuideId(), tripId, rating);
        }
        outbox.audit(touristId, "review_trip", updated, details("rating", rating));
        return updated;
    }

    /**
     * Records a guide's proposed schedule change on a confirmed trip. A newer proposal supersedes the pending one.
     */
    @Transactional
    public TripProposal proposeChange(Long guideId, UUID tripId, ProposeChangeRequest request) {
        boolean hasItinerary = request.itinerary() != null && !request.itinerary().isEmpty();
        if (!hasItinerary && request.startAt() == null) {
            throw new ValidationException("A proposal must change the itinerary or the start time");
        }
        Instant now = clock.instant();
        if (request.startAt() != null && !request.startAt().isAfter(now)) {
            throw new ValidationException("Proposed start time must be in the future");
        }
        Trip trip = access.load(tripId);
        access.requireAssignedGuide(trip, guideId, "propose changes");
        requireConfirmed(trip);

        Optional<TripProposal> superseded = activeProposal(trip).filter(TripProposal::isPending);
        superseded.ifPresent(previous -> {
            previous.resolve(ProposalStatus.SUPERSEDED, null, now);
            proposalRepository.save(previous);
        });

        List<ItineraryStop> stops = hasItinerary
                ? request.itinerary().stream().map(ItineraryStopRequest::toStop).toList()
                : trip.getItinerary().stream().map(ItineraryStop::copy).toList();
        TripProposal proposal = proposalRepository.save(TripProposal.builder()
                .tripId(tripId)
                .guideId(guideId)
                .proposedStartAt(request.startAt() != null ? request.startAt() : trip.getStartAt())
                .proposedItinerary(new ArrayList<>(stops))
                .note(request.note())
                .status(ProposalStatus.PENDING)
                .createdAt(now)
                .build());

        Trip updated = access.writeOrConflict(trip,
                TripPatch.keepStatus().with(t -> t.setActiveProposalId(proposal.getId())),
                CONFLICT_MESSAGE);
        log.info("Guide {} proposed change {} for trip {}{}", guideId, proposal.getId(), tripId,
                superseded.map(p -> " (supersedes " + p.getId() + ")").orElse(""));

        outbox.notify(updated, TripNotificationType.PROPOSAL_RECEIVED, updated.getTouristId(), details(
                "proposalId", proposal.getId(),
                "proposedStartAt", proposal.getProposedStartAt().toString(),
                "note", proposal.getNote()));
        outbox.audit(guideId, "propose_change", updated, details("proposalId", proposal.getId()));
        return proposal;
    }

    /**
     * Applies the active proposal: re-estimates the duration, re-checks the guide's calendar and recomputes the
     * price breakdown. The paid price is not changed.
     */
    @Transactional
    public Trip acceptProposal(Long touristId, UUID tripId) {
        Trip trip = access.load(tripId);
        access.requireTourist(trip, touristId, "accept proposals");
        requireConfirmed(trip);
        TripProposal proposal = requirePendingProposal(trip);

        Instant startAt = proposal.getProposedStartAt();
        int duration;
        Instant endAt;
        if (proposal.getProposedItinerary().isEmpty()) {
            duration = trip.effectiveDurationMinutes();
            endAt = startAt.plusSeconds(duration * 60L);
        } else {
            TripEstimate estimate = pricingService.estimate(proposal.getProposedItinerary(), startAt);
            duration = estimate.totalMinutes();
            endAt = estimate.endAt();
        }
        access.ensureGuideAvailable(trip.getSelectedGuideId(), tripId, startAt, endAt);
        PriceBreakdown breakdown = recomputeBreakdown(trip, duration, proposal.getProposedItinerary());

        Instant now = clock.instant();
        Trip updated = access.writeOrConflict(trip,
                TripPatch.keepStatus().with(t -> {
                    t.setStartAt(startAt);
                    t.setEndAt(endAt);
                    t.setTotalDurationMinutes(duration);
                    t.replaceItinerary(proposal.getProposedItinerary());
                    if (breakdown != null) {
                        t.setPriceBreakdown(breakdown);
                    }
                    t.setActiveProposalId(null);
                }),
                CONFLICT_MESSAGE);
        proposal.resolve(ProposalStatus.ACCEPTED, null, now);
        proposalRepository.save(proposal);
        log.info("Proposal {} accepted for trip {}: starts {} for {} minutes", proposal.getId(), tripId, startAt, duration);

        access.notifyGuide(updated, updated.getSelectedGuideId(), TripNotificationType.PROPOSAL_ACCEPTED,
                details("proposalId", proposal.getId()));
        outbox.audit(touristId, "accept_proposal", updated, details(
                "proposalId", proposal.getId(),
                "startAt", startAt.toString(),
                "totalDurationMinutes", duration));
        return updated;
    }

    @Transactional
    public TripProposal rejectProposal(Long touristId, UUID tripId, String note) {
        Trip trip = access.load(tripId);
        access.requireTourist(trip, touristId, "reject proposals");
        requireConfirmed(trip);
        TripProposal proposal = requirePendingProposal(trip);

        Trip updated = access.writeOrConflict(trip,
                TripPatch.keepStatus().with(t -> t.setActiveProposalId(null)),
                CONFLICT_MESSAGE);
        proposal.resolve(ProposalStatus.REJECTED, note, clock.instant());
        TripProposal rejected = proposalRepository.save(proposal);

        access.notifyGuide(updated, updated.getSelectedGuideId(), TripNotificationType.PROPOSAL_REJECTED,
                details("proposalId", proposal.getId(), "note", note));
        outbox.audit(touristId, "reject_proposal", updated, details("proposalId", proposal.getId()));
        return rejected;
    }

    /** Newest first, superseded and resolved ones included. */
    @Transactional(readOnly = true)
    public List<TripProposal> listProposals(UUID tripId) {
        return proposalRepository.findByTripIdOrderByCreatedAtDesc(tripId);
    }

    private void requireConfirmed(Trip trip) {
        if (trip.getStatus() != TripStatus.CONFIRMED) {
            throw new BusinessRuleViolationException(
                    "Changes can only be proposed on confirmed trips, trip is " + trip.getStatus().getValue(),
                    "TRIP_NOT_CONFIRMED");
        }
    }

    private Optional<TripProposal> activeProposal(Trip trip) {
        return trip.getActiveProposalId() == null ? Optional.empty()
                : proposalRepository.findById(trip.getActiveProposalId());
    }

    private TripProposal requirePendingProposal(Trip trip) {
        if (trip.getActiveProposalId() == null) {
            throw new BusinessRuleViolationException("Trip has no pending proposal", "NO_ACTIVE_PROPOSAL");
        }
        TripProposal proposal = proposalRepository.findById(trip.getActiveProposalId())
                .orElseThrow(() -> new ResourceNotFoundException("Proposal", trip.getActiveProposalId()));
        if (!proposal.isPending()) {
            throw new BusinessRuleViolationException("Proposal is already " + proposal.getStatus(), "NO_ACTIVE_PROPOSAL");
        }
        return proposal;
    }

    private PriceBreakdown recomputeBreakdown(Trip trip, int duration, List<ItineraryStop> itinerary) {
        try {
            return directoryGateway.findGuide(trip.getSelectedGuideId())
                    .map(GuideView::pricePerHour)
                    .map(rate -> pricingService.priceBreakdown(rate, duration, itinerary))
                    .orElse(null);
        } catch (Exception e) {
            log.warn("Could not recompute price breakdown for trip {} (non-fatal)", trip.getId(), e);
            return null;
        }
    }
}
