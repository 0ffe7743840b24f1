package com.openguide.trip.orchestration;

import com.openguide.common.exception.BusinessRuleViolationException;
import com.openguide.common.exception.ForbiddenException;
import com.openguide.common.exception.InvalidTransitionException;
import com.openguide.common.exception.ResourceNotFoundException;
import com.openguide.common.exception.ValidationException;
import com.openguide.trip.api.dto.CreateTripRequest;
import com.openguide.trip.api.dto.EndCallRequest;
import com.openguide.trip.api.dto.ItineraryStopRequest;
import com.openguide.trip.call.CallEndResult;
import com.openguide.trip.call.CallJoin;
import com.openguide.trip.call.CallSessionService;
import com.openguide.trip.client.DirectoryGateway;
import com.openguide.trip.client.dto.GuideView;
import com.openguide.trip.client.dto.PlaceView;
import com.openguide.trip.client.dto.UserView;
import com.openguide.trip.domain.model.CallEndReason;
import com.openguide.trip.domain.model.CallRecord;
import com.openguide.trip.domain.model.CallSession;
import com.openguide.trip.domain.model.GeoPoint;
import com.openguide.trip.domain.model.ItineraryStop;
import com.openguide.trip.domain.model.PaymentStatus;
import com.openguide.trip.domain.model.PriceBreakdown;
import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.model.TripActor;
import com.openguide.trip.domain.model.TripStatus;
import com.openguide.trip.domain.service.CandidateFilter;
import com.openguide.trip.domain.service.CandidateGuideService;
import com.openguide.trip.domain.service.CandidateSearch;
import com.openguide.trip.domain.service.PricingService;
import com.openguide.trip.domain.state.TripStateMachine;
import com.openguide.trip.domain.store.TripPatch;
import com.openguide.trip.domain.store.TripStore;
import com.openguide.trip.domain.store.UpdateResult;
import com.openguide.trip.events.TripEventOutbox;
import com.openguide.trip.events.TripNotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.openguide.trip.domain.model.TripStatus.*;

/**
 * Trip negotiation and lifecycle operations.
 * <p>
 * Every operation runs load, authorize, validate, conditional write, then side effects. The write is a status
 * compare-and-swap on the status validated against; side effects go to the outbox in the same transaction and
 * are delivered after commit, so they never block or fail the transition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TripOrchestrator {

    private static final String CONFLICT_MESSAGE = "Trip was updated by another request. Please refresh and try again.";
    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

    private final TripAccess access;
    private final TripStore tripStore;
    private final CallSessionService callSessionService;
    private final CandidateGuideService candidateGuideService;
    private final PricingService pricingService;
    private final DirectoryGateway directoryGateway;
    private final TripEventOutbox outbox;
    private final Clock clock;

    @Value("${trip.cancellation.min-lead-hours:24}")
    private long minCancellationLeadHours;

    @Value("${trip.default-duration-minutes:240}")
    private int defaultDurationMinutes;

    @Value("${trip.pricing.default-price-per-hour:20}")
    private BigDecimal defaultPricePerHour;

    @Value("${trip.payment.currency:usd}")
    private String currency;

    // ---------------------------------------------------------------- creation and guide selection

    /**
     * Creates a trip in {@code selecting_guide} and returns the first page of candidate guides with it.
     */
    @Transactional
    public TripCreation createTrip(Long touristId, CreateTripRequest request) {
        Instant now = clock.instant();
        if (request.startAt() == null || !request.startAt().isAfter(now)) {
            throw new ValidationException("Trip start time must be in the future");
        }
        if (request.totalDurationMinutes() != null && request.totalDurationMinutes() <= 0) {
            throw new ValidationException("Trip duration must be positive");
        }
        UserView tourist = directoryGateway.findUser(touristId)
                .orElseThrow(() -> new ResourceNotFoundException("User", touristId));
        if (!tourist.isTourist()) {
            throw new ForbiddenException("Only tourists can create trips");
        }
        if (request.sourceCallId() != null) {
            rejectDuplicate(touristId, request.sourceCallId(), request.startAt());
        }
        Long provinceId = resolveProvince(request);
        TripStateMachine.validateTransition(DRAFT, SELECTING_GUIDE);

        int duration = request.totalDurationMinutes() != null ? request.totalDurationMinutes() : defaultDurationMinutes;
        List<ItineraryStop> stops = request.itinerary() == null ? new ArrayList<>()
                : new ArrayList<>(request.itinerary().stream().map(ItineraryStopRequest::toStop).toList());
        Trip draft = Trip.builder()
                .touristId(touristId)
                .provinceId(provinceId)
                .createdFromPlaceId(request.createdFromPlaceId())
                .sourceCallId(request.sourceCallId())
                .startAt(request.startAt())
                .totalDurationMinutes(duration)
                .endAt(request.startAt().plus(Duration.ofMinutes(duration)))
                .itinerary(stops)
                .currency(currency)
                .paymentStatus(PaymentStatus.UNPAID)
                .meetingPoint(request.meetingPoint() == null ? null
                        : GeoPoint.of(request.meetingPoint().latitude(), request.meetingPoint().longitude()))
                .meetingAddress(request.meetingAddress())
                .notes(request.notes())
                .status(SELECTING_GUIDE)
                .build();
        CandidateSearch candidates = initialCandidates(draft);
        draft.replaceCandidateGuides(candidates.candidateGuideIds());
        Trip created = tripStore.create(draft);
        log.info("Trip {} created by tourist {} in province {}", created.getId(), touristId, provinceId);

        outbox.audit(touristId, "create_trip", created, details(
                "provinceId", provinceId,
                "startAt", request.startAt().toString(),
                "stops", stops.size()));
        return new TripCreation(created, candidates.page());
    }

    @Transactional
    public Trip selectGuide(UUID tripId, Long touristId, Long guideId) {
        Trip trip = access.load(tripId);
        access.requireTourist(trip, touristId, "select a guide");
        TripStateMachine.validateTransition(trip.getStatus(), AWAITING_CALL);
        GuideView guide = directoryGateway.findGuide(guideId)
                .orElseThrow(() -> new ResourceNotFoundException("Guide", guideId));
        if (!guide.active()) {
            throw new BusinessRuleViolationException("Guide is not currently accepting trips", "GUIDE_INACTIVE");
        }

        Trip updated = access.writeOrConflict(trip,
                TripPatch.transitionTo(AWAITING_CALL).with(t -> t.setSelectedGuideId(guideId)),
                CONFLICT_MESSAGE);

        outbox.notify(updated, TripNotificationType.GUIDE_SELECTED, guide.userId(), details("touristId", touristId));
        outbox.statusChanged(updated);
        outbox.audit(touristId, "select_guide", updated, details("guideId", guideId));
        return updated;
    }

    /**
     * Back to {@code selecting_guide} after a rejection, or to change the chosen guide before calling.
     */
    @Transactional
    public TripCreation reopenGuideSelection(UUID tripId, Long touristId) {
        Trip trip = access.load(tripId);
        access.requireTourist(trip, touristId, "reopen guide selection");
        TripStateMachine.validateTransition(trip.getStatus(), SELECTING_GUIDE);
        Long previousGuideId = trip.getSelectedGuideId();
        CandidateSearch candidates = initialCandidates(trip);

        Trip updated = access.writeOrConflict(trip,
                TripPatch.transitionTo(SELECTING_GUIDE).with(t -> {
                    t.setSelectedGuideId(null);
                    t.clearCancellation();
                    t.replaceCandidateGuides(candidates.candidateGuideIds());
                }),
                CONFLICT_MESSAGE);

        access.notifyGuide(updated, previousGuideId, TripNotificationType.GUIDE_DESELECTED, details("touristId", touristId));
        outbox.statusChanged(updated);
        outbox.audit(touristId, "reopen_guide_selection", updated, details(
                "previousStatus", trip.getStatus().getValue(),
                "previousGuideId", previousGuideId));
        return new TripCreation(updated, candidates.page());
    }

    // ---------------------------------------------------------------- negotiation call

    /**
     * Starts (or, while already {@code in_call}, rejoins) the negotiation call and returns the tourist's join info.
     */
    @Transactional
    public CallInitiation initiateCall(UUID tripId, Long touristId) {
        Trip trip = access.load(tripId);
        access.requireTourist(trip, touristId, "start a call");
        if (trip.getStatus() != IN_CALL) {
            TripStateMachine.validateTransition(trip.getStatus(), IN_CALL);
        }
        if (trip.getSelectedGuideId() == null) {
            throw new BusinessRuleViolationException("Select a guide before calling", "GUIDE_NOT_SELECTED");
        }

        if (trip.getStatus() == IN_CALL) {
            Optional<CallSession> live = liveCall(trip);
            if (live.isPresent()) {
                log.info("Tourist {} rejoining live call {} of trip {}", touristId, live.get().getId(), tripId);
                return new CallInitiation(trip, callSessionService.join(live.get().getId(), touristId));
            }
        }

        GuideView guide = directoryGateway.findGuide(trip.getSelectedGuideId())
                .orElseThrow(() -> new ResourceNotFoundException("Guide", trip.getSelectedGuideId()));
        CallSession session = callSessionService.createSession(touristId, guide.userId(), tripId);
        CallRecord record = CallRecord.builder()
                .callId(session.getId())
                .guideId(guide.id())
                .startedAt(session.getStartedAt())
                .build();

        Trip updated = access.writeOrConflict(trip,
                TripPatch.transitionTo(IN_CALL).with(t -> t.getCallRecords().add(record)),
                CONFLICT_MESSAGE);

        outbox.notify(updated, TripNotificationType.INCOMING_CALL, guide.userId(), details(
                "callId", session.getId(),
                "touristId", touristId));
        if (trip.getStatus() != IN_CALL) {
            outbox.statusChanged(updated);
        }
        outbox.audit(touristId, "initiate_call", updated, details("callId", session.getId()));

        CallJoin join = callSessionService.join(session.getId(), touristId);
        return new CallInitiation(updated, join);
    }

    /**
     * Ends a call on behalf of one of its parties and moves an {@code in_call} trip to {@code pending_confirmation}.
     * Ending an already ended call returns the trip unchanged.
     */
    @Transactional
    public Trip endCall(UUID callId, Long userId, EndCallRequest request) {
        BigDecimal price = request != null ? request.negotiatedPrice() : null;
        if (price != null && price.signum() < 0) {
            throw new ValidationException("Negotiated price cannot be negative");
        }
        CallSession session = callSessionService.findById(callId)
                .orElseThrow(() -> new ResourceNotFoundException("Call session", callId));
        if (session.getTripId() == null) {
            throw new ResourceNotFoundException("Trip for call", callId);
        }
        Trip trip = access.load(session.getTripId());
        if (!session.isParticipant(userId)) {
            throw new ForbiddenException("Only the call's parties can end it");
        }
        CallEndReason reason = request != null && request.endReason() != null ? request.endReason() : CallEndReason.COMPLETED;
        String summary = request != null ? request.summary() : null;
        return finishCall(session, trip, userId, reason, summary, price);
    }

    /**
     * Auto-end path for a call that reached its deadline. A call that already ended is ignored: no write and
     * no second status update.
     */
    @Transactional
    public Optional<Trip> expireCall(UUID callId) {
        Optional<CallSession> found = callSessionService.findById(callId);
        if (found.isEmpty()) {
            log.warn("Deadline fired for unknown call {}", callId);
            return Optional.empty();
        }
        CallSession session = found.get();
        if (session.isFinished()) {
            log.debug("Call {} already ended ({}), timeout ignored", callId, session.getEndReason());
            return Optional.empty();
        }
        if (session.getTripId() == null) {
            callSessionService.end(callId, CallEndReason.TIMEOUT, null, null);
            return Optional.empty();
        }
        Trip trip = access.load(session.getTripId());
        return Optional.of(finishCall(session, trip, null, CallEndReason.TIMEOUT, null, null));
    }

    private Trip finishCall(CallSession session, Trip trip, Long actorUserId, CallEndReason reason,
                            String summary, BigDecimal price) {
        CallEndResult ended = callSessionService.end(session.getId(), reason, summary, price);
        if (!ended.endedNow()) {
            log.info("Call {} already ended ({}), trip {} left as is", session.getId(), ended.session().getEndReason(), trip.getId());
            return trip;
        }
        Instant endedAt = ended.session().getEndedAt();
        TripStatus current = trip.getStatus();
        TripStatus next = current == IN_CALL ? PENDING_CONFIRMATION : current;

        TripPatch patch = next != current ? TripPatch.transitionTo(next) : TripPatch.keepStatus();
        patch.with(t -> t.findCallRecord(session.getId()).ifPresent(r -> r.close(endedAt, summary, price)));
        if (price != null) {
            patch.with(t -> t.setNegotiatedPrice(price));
        }
        Trip updated = access.writeOrConflict(trip, patch, CONFLICT_MESSAGE);

        outbox.notify(updated, TripNotificationType.CALL_ENDED, session.getGuideUserId(), details(
                "callId", session.getId(),
                "endReason", reason.getValue(),
                "negotiatedPrice", price,
                "summary", summary));
        outbox.statusChanged(updated);
        outbox.audit(actorUserId, "end_call", updated, details(
                "callId", session.getId(),
                "endReason", reason.getValue(),
                "negotiatedPrice", price,
                "previousStatus", current.getValue()));
        return updated;
    }

    private Optional<CallSession> liveCall(Trip trip) {
        List<CallRecord> records = trip.getCallRecords();
        for (int i = records.size() - 1; i >= 0; i--) {
            CallRecord record = records.get(i);
            if (record.getEndedAt() == null) {
                Optional<CallSession> session = callSessionService.findById(record.getCallId());
                if (session.isPresent() && !session.get().isFinished()) {
                    return session;
                }
            }
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------- guide decision

    /**
     * Moves the trip to {@code awaiting_payment}. Already awaiting payment or confirmed is a no-op success.
     * Accepting straight from {@code in_call} without a negotiated price prices the trip at duration x hourly rate.
     */
    @Transactional
    public Trip guideAccept(UUID tripId, Long guideId) {
        Trip trip = access.load(tripId);
        access.requireAssignedGuide(trip, guideId, "accept it");
        if (trip.getStatus() == AWAITING_PAYMENT || trip.getStatus() == CONFIRMED) {
            log.info("Trip {} already {}, accept is a no-op", tripId, trip.getStatus().getValue());
            return trip;
        }
        TripStateMachine.validateTransition(trip.getStatus(), AWAITING_PAYMENT);

        Optional<GuideView> guide = directoryGateway.findGuide(guideId);
        BigDecimal price = trip.getNegotiatedPrice();
        if (price == null && trip.getStatus() == IN_CALL) {
            price = directAcceptPrice(trip, guide.map(GuideView::pricePerHour).orElse(null));
            log.info("Trip {} accepted from call without a negotiated price, priced at {}", tripId, price);
        }
        if (price == null) {
            throw new BusinessRuleViolationException("A negotiated price is required before payment", "PRICE_NOT_NEGOTIATED");
        }
        access.ensureGuideAvailable(guideId, tripId, trip.getStartAt(), trip.getEndAt());
        PriceBreakdown breakdown = breakdownOrNull(trip, guide.map(GuideView::pricePerHour).orElse(null));

        BigDecimal agreedPrice = price;
        Trip updated = access.writeOrConflict(trip,
                TripPatch.transitionTo(AWAITING_PAYMENT).with(t -> {
                    t.setNegotiatedPrice(agreedPrice);
                    t.setPaymentStatus(PaymentStatus.PENDING);
                    if (breakdown != null) {
                        t.setPriceBreakdown(breakdown);
                    }
                }),
                CONFLICT_MESSAGE);

        outbox.notify(updated, TripNotificationType.PAYMENT_REQUIRED, updated.getTouristId(), details(
                "amount", agreedPrice,
                "currency", updated.getCurrency()));
        outbox.statusChanged(updated);
        outbox.audit(guideId, "guide_accept", updated, details(
                "negotiatedPrice", agreedPrice,
                "previousStatus", trip.getStatus().getValue()));
        return updated;
    }

    @Transactional
    public Trip guideReject(UUID tripId, Long guideId, String reason) {
        Trip trip = access.load(tripId);
        access.requireAssignedGuide(trip, guideId, "reject it");
        TripStateMachine.validateTransition(trip.getStatus(), REJECTED);
        String rejectionReason = reason == null || reason.isBlank() ? "Rejected by guide" : reason;
        Instant now = clock.instant();

        Trip updated = access.writeOrConflict(trip,
                TripPatch.transitionTo(REJECTED).with(t -> {
                    t.setSelectedGuideId(null);
                    t.setCancellationReason(rejectionReason);
                    t.setCancelledBy(TripActor.GUIDE);
                    t.setCancelledAt(now);
                }),
                CONFLICT_MESSAGE);

        outbox.notify(updated, TripNotificationType.TRIP_REJECTED, updated.getTouristId(), details(
                "guideId", guideId,
                "reason", rejectionReason));
        outbox.statusChanged(updated);
        outbox.audit(guideId, "guide_reject", updated, details("reason", rejectionReason));
        return updated;
    }

    // ---------------------------------------------------------------- cancellation and lifecycle

    /**
     * Cancels a trip at least {@code trip.cancellation.min-lead-hours} before it starts. A late cancellation is a
     * business rule violation, not a transition error.
     */
    @Transactional
    public Trip cancelTrip(Long actorId, UUID tripId, String reason, TripActor actorRole) {
        Trip trip = access.load(tripId);
        if (actorRole == TripActor.TOURIST) {
            access.requireTourist(trip, actorId, "cancel it");
        } else if (actorRole == TripActor.GUIDE) {
            access.requireAssignedGuide(trip, actorId, "cancel it");
        } else {
            throw new ForbiddenException("Only the trip's tourist or guide can cancel it");
        }
        if (trip.getStatus() == COMPLETED || trip.getStatus() == CANCELLED) {
            throw new InvalidTransitionException(trip.getStatus().getValue(), CANCELLED.getValue());
        }
        Instant now = clock.instant();
        Duration lead = Duration.between(now, trip.getStartAt());
        if (lead.compareTo(Duration.ofHours(minCancellationLeadHours)) < 0) {
            throw new BusinessRuleViolationException(
                    "Trips can only be cancelled at least " + minCancellationLeadHours + " hours before the start",
                    "CANCELLATION_WINDOW");
        }
        TripStateMachine.validateTransition(trip.getStatus(), CANCELLED);
        String cancellationReason = reason == null || reason.isBlank() ? "Cancelled by " + actorRole.getValue() : reason;
        // A live call dies with the trip, so its deadline later finds it finished.
        Optional<CallSession> endedCall = liveCall(trip)
                .map(session -> callSessionService.end(session.getId(), CallEndReason.CANCELLED, null, null))
                .filter(CallEndResult::endedNow)
                .map(CallEndResult::session);

        Trip updated = access.writeOrConflict(trip,
                TripPatch.transitionTo(CANCELLED).with(t -> {
                    t.setCancellationReason(cancellationReason);
                    t.setCancelledBy(actorRole);
                    t.setCancelledAt(now);
                    endedCall.ifPresent(call -> t.findCallRecord(call.getId())
                            .ifPresent(r -> r.close(call.getEndedAt(), null, null)));
                }),
                CONFLICT_MESSAGE);
        endedCall.ifPresent(call -> log.info("Call {} ended with cancelled trip {}", call.getId(), tripId));

        Map<String, Object> payload = details("reason", cancellationReason, "cancelledBy", actorRole.getValue());
        if (actorRole == TripActor.TOURIST) {
            access.notifyGuide(updated, trip.getSelectedGuideId(), TripNotificationType.TRIP_CANCELLED, payload);
        } else {
            outbox.notify(updated, TripNotificationType.TRIP_CANCELLED, updated.getTouristId(), payload);
        }
        outbox.statusChanged(updated);
        outbox.audit(actorId, "cancel_trip", updated, details(
                "reason", cancellationReason,
                "cancelledBy", actorRole.getValue(),
                "previousStatus", trip.getStatus().getValue(),
                "endedCallId", endedCall.map(CallSession::getId).orElse(null)));
        return updated;
    }

    @Transactional
    public Trip startTrip(Long guideId, UUID tripId) {
        Trip trip = access.load(tripId);
        access.requireAssignedGuide(trip, guideId, "start it");
        TripStateMachine.validateTransition(trip.getStatus(), IN_PROGRESS);

        Trip updated = access.writeOrConflict(trip, TripPatch.transitionTo(IN_PROGRESS), CONFLICT_MESSAGE);

        outbox.notify(updated, TripNotificationType.TRIP_STARTED, updated.getTouristId(), details("guideId", guideId));
        outbox.statusChanged(updated);
        outbox.audit(guideId, "start_trip", updated, details());
        return updated;
    }

    /** Completes the trip and bumps the guide's lifetime trip count. */
    @Transactional
    public Trip completeTrip(Long guideId, UUID tripId) {
        Trip trip = access.load(tripId);
        access.requireAssignedGuide(trip, guideId, "complete it");
        TripStateMachine.validateTransition(trip.getStatus(), COMPLETED);

        Trip updated = access.writeOrConflict(trip, TripPatch.transitionTo(COMPLETED), CONFLICT_MESSAGE);

        outbox.guideTripCompleted(guideId, tripId);
        outbox.notify(updated, TripNotificationType.TRIP_COMPLETED, updated.getTouristId(), details("guideId", guideId));
        outbox.statusChanged(updated);
        outbox.audit(guideId, "complete_trip", updated, details("previousStatus", trip.getStatus().getValue()));
        return updated;
    }

    @Transactional
    public Trip archiveTrip(Long touristId, UUID tripId) {
        Trip trip = access.load(tripId);
        access.requireTourist(trip, touristId, "archive it");
        TripStateMachine.validateTransition(trip.getStatus(), ARCHIVED);

        Trip updated = access.writeOrConflict(trip, TripPatch.transitionTo(ARCHIVED), CONFLICT_MESSAGE);

        outbox.statusChanged(updated);
        outbox.audit(touristId, "archive_trip", updated, details("previousStatus", trip.getStatus().getValue()));
        return updated;
    }

    // ---------------------------------------------------------------- payment

    /**
     * Applies a provider payment confirmation. Never throws for trip-state reasons: every outcome is reported so
     * the webhook can acknowledge it. The single CAS attempt is not retried; a redelivery retries the whole event.
     */
    @Transactional
    public PaymentOutcome confirmPayment(UUID tripId, String paymentIntentId) {
        Optional<Trip> found = tripStore.findById(tripId);
        if (found.isEmpty()) {
            log.error("Payment confirmation for unknown trip {}, acknowledged without processing", tripId);
            return PaymentOutcome.TRIP_NOT_FOUND;
        }
        Trip trip = found.get();
        if (trip.getPaymentStatus() == PaymentStatus.PAID) {
            log.info("Trip {} already paid, duplicate confirmation ignored", tripId);
            return PaymentOutcome.ALREADY_PAID;
        }
        if (!TripStateMachine.canTransition(trip.getStatus(), CONFIRMED)) {
            log.error("Payment received for trip {} in status {}; not confirming. Manual refund review required",
                    tripId, trip.getStatus().getValue());
            return PaymentOutcome.INVALID_TRANSITION;
        }
        Instant now = clock.instant();
        UpdateResult result = tripStore.updateIfStatus(tripId, trip.getStatus(),
                TripPatch.transitionTo(CONFIRMED).with(t -> {
                    t.setPaymentStatus(PaymentStatus.PAID);
                    t.setPaymentIntentId(paymentIntentId);
                    t.setConfirmedAt(now);
                }));
        if (!result.updated()) {
            log.warn("Trip {} changed during payment confirmation (now {}), not retrying",
                    tripId, result.trip().getStatus().getValue());
            return PaymentOutcome.CONCURRENT_UPDATE;
        }
        Trip confirmed = result.trip();
        log.info("Trip {} confirmed by payment {}", tripId, paymentIntentId);

        outbox.notify(confirmed, TripNotificationType.PAYMENT_CONFIRMED, confirmed.getTouristId(), details(
                "amount", confirmed.getNegotiatedPrice(),
                "currency", confirmed.getCurrency()));
        access.notifyGuide(confirmed, confirmed.getSelectedGuideId(), TripNotificationType.TRIP_CONFIRMED,
                details("startAt", confirmed.getStartAt().toString()));
        outbox.statusChanged(confirmed);
        outbox.audit(null, "payment_confirmed", confirmed, details("paymentIntentId", paymentIntentId));
        return PaymentOutcome.CONFIRMED;
    }

    // ---------------------------------------------------------------- helpers

    private void rejectDuplicate(Long touristId, UUID sourceCallId, Instant startAt) {
        LocalDate day = startAt.atZone(ZoneOffset.UTC).toLocalDate();
        Instant dayStart = day.atStartOfDay(ZoneOffset.UTC).toInstant();
        tripStore.findDuplicate(sourceCallId, touristId, dayStart, dayStart.plus(Duration.ofDays(1)))
                .ifPresent(existing -> {
                    log.info("Duplicate trip for call {} and tourist {}: {}", sourceCallId, touristId, existing.getId());
                    throw new BusinessRuleViolationException(
                            "A trip for this call already exists on that day: " + existing.getId(), "DUPLICATE_TRIP");
                });
    }

    private Long resolveProvince(CreateTripRequest request) {
        if (request.provinceId() != null) {
            return request.provinceId();
        }
        if (request.createdFromPlaceId() != null) {
            Optional<Long> fromPlace = directoryGateway.findPlace(request.createdFromPlaceId()).map(PlaceView::provinceId);
            if (fromPlace.isPresent()) {
                return fromPlace.get();
            }
            log.info("Place {} does not resolve to a province", request.createdFromPlaceId());
        }
        throw new ValidationException("A province is required: give provinceId or a place that belongs to one");
    }

    /** Read-only lookup; the caller stores the ids in its own trip write. */
    private CandidateSearch initialCandidates(Trip trip) {
        CandidateFilter filter = CandidateFilter.defaults();
        try {
            return candidateGuideService.search(trip, filter);
        } catch (Exception e) {
            log.warn("Could not load candidate guides for trip {} in province {} (non-fatal)",
                    trip.getId(), trip.getProvinceId(), e);
            return CandidateSearch.empty(filter);
        }
    }

    private BigDecimal directAcceptPrice(Trip trip, BigDecimal pricePerHour) {
        BigDecimal rate = pricePerHour != null ? pricePerHour : defaultPricePerHour;
        int minutes = trip.getTotalDurationMinutes() != null ? trip.getTotalDurationMinutes() : defaultDurationMinutes;
        return rate.multiply(BigDecimal.valueOf(minutes))
                .divide(MINUTES_PER_HOUR, 0, RoundingMode.HALF_UP);
    }

    private PriceBreakdown breakdownOrNull(Trip trip, BigDecimal pricePerHour) {
        if (pricePerHour == null) {
            return null;
        }
        try {
            return pricingService.priceBreakdown(pricePerHour, trip.effectiveDurationMinutes(), trip.getItinerary());
        } catch (Exception e) {
            log.warn("Price breakdown unavailable for trip {} (non-fatal)", trip.getId(), e);
            return null;
        }
    }

    /** Ordered key/value pairs; null values are dropped. */
    static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return details;
    }
}
