package com.openguide.trip.api.controller;

import com.openguide.common.dto.BaseResponse;
import com.openguide.common.exception.ValidationException;
import com.openguide.common.util.Constants;
import com.openguide.trip.api.dto.CallInitiationResponse;
import com.openguide.trip.api.dto.CallJoinResponse;
import com.openguide.trip.api.dto.CancelTripRequest;
import com.openguide.trip.api.dto.CandidateGuidesResponse;
import com.openguide.trip.api.dto.CheckoutSessionResponse;
import com.openguide.trip.api.dto.CreateTripRequest;
import com.openguide.trip.api.dto.EstimateRequest;
import com.openguide.trip.api.dto.ProposalResponse;
import com.openguide.trip.api.dto.ProposeChangeRequest;
import com.openguide.trip.api.dto.RejectProposalRequest;
import com.openguide.trip.api.dto.RejectTripRequest;
import com.openguide.trip.api.dto.ReviewTripRequest;
import com.openguide.trip.api.dto.SelectGuideRequest;
import com.openguide.trip.api.dto.TripCreatedResponse;
import com.openguide.trip.api.dto.TripEstimateResponse;
import com.openguide.trip.api.dto.TripResponse;
import com.openguide.trip.domain.model.TripActor;
import com.openguide.trip.domain.service.CandidateFilter;
import com.openguide.trip.domain.service.CandidateGuideService;
import com.openguide.trip.orchestration.CallInitiation;
import com.openguide.trip.orchestration.TripCheckoutService;
import com.openguide.trip.orchestration.TripCreation;
import com.openguide.trip.orchestration.TripOrchestrator;
import com.openguide.trip.orchestration.TripProposalService;
import com.openguide.trip.orchestration.TripQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Trip negotiation and lifecycle endpoints. Tourists identify with {@code X-User-Id}, guides with
 * {@code X-Guide-Id}; both are set by the gateway.
 */
@RestController
@RequestMapping("/api/v1/trips")
@RequiredArgsConstructor
public class TripController {

    private final TripOrchestrator tripOrchestrator;
    private final TripProposalService proposalService;
    private final TripCheckoutService checkoutService;
    private final TripQueryService queryService;
    private final CandidateGuideService candidateGuideService;

    @PostMapping
    public ResponseEntity<BaseResponse<TripCreatedResponse>> createTrip(
            @RequestHeader(Constants.USER_ID_HEADER) Long touristId,
            @Valid @RequestBody CreateTripRequest request) {
        TripCreation creation = tripOrchestrator.createTrip(touristId, request);
        return ResponseEntity.ok(BaseResponse.success("Trip created successfully", toResponse(creation)));
    }

    @PostMapping("/estimate")
    public ResponseEntity<BaseResponse<TripEstimateResponse>> estimate(@Valid @RequestBody EstimateRequest request) {
        TripEstimateResponse response = TripEstimateResponse.from(queryService.estimate(request.itinerary(), request.startAt()));
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<TripResponse>> getTrip(
            @PathVariable UUID id,
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) Long userId,
            @RequestHeader(value = Constants.GUIDE_ID_HEADER, required = false) Long guideId) {
        return ResponseEntity.ok(BaseResponse.success(TripResponse.from(queryService.getTrip(id, userId, guideId))));
    }

    @GetMapping("/tourist/me")
    public ResponseEntity<BaseResponse<List<TripResponse>>> getTouristTrips(
            @RequestHeader(Constants.USER_ID_HEADER) Long touristId) {
        List<TripResponse> response = queryService.findByTourist(touristId).stream().map(TripResponse::from).toList();
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/guide/me")
    public ResponseEntity<BaseResponse<List<TripResponse>>> getGuideTrips(
            @RequestHeader(Constants.GUIDE_ID_HEADER) Long guideId) {
        List<TripResponse> response = queryService.findByGuide(guideId).stream().map(TripResponse::from).toList();
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/{id}/guides")
    public ResponseEntity<BaseResponse<CandidateGuidesResponse>> listCandidateGuides(
            @PathVariable UUID id,
            @RequestHeader(Constants.USER_ID_HEADER) Long touristId,
            @RequestParam(required = false) String language,
            @RequestParam(required = false) Double maxDistanceKm,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        queryService.getTrip(id, touristId, null);
        CandidateGuidesResponse response = CandidateGuidesResponse.from(candidateGuideService.listCandidateGuides(id,
                new CandidateFilter(language, maxDistanceKm, page, limit)));
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/{id}/guide")
    public ResponseEntity<BaseResponse<TripResponse>> selectGuide(
            @PathVariable UUID id,
            @RequestHeader(Constants.USER_ID_HEADER) Long touristId,
            @Valid @RequestBody SelectGuideRequest request) {
        TripResponse response = TripResponse.from(tripOrchestrator.selectGuide(id, touristId, request.guideId()));
        return ResponseEntity.ok(BaseResponse.success("Guide selected successfully", response));
    }

    @PostMapping("/{id}/reopen")
    public ResponseEntity<BaseResponse<TripCreatedResponse>> reopenGuideSelection(
            @PathVariable UUID id,
            @RequestHeader(Constants.USER_ID_HEADER) Long touristId) {
        TripCreation creation = tripOrchestrator.reopenGuideSelection(id, touristId);
        return ResponseEntity.ok(BaseResponse.success("Guide selection reopened", toResponse(creation)));
    }

    @PostMapping("/{id}/calls")
    public ResponseEntity<BaseResponse<CallInitiationResponse>> initiateCall(
            @PathVariable UUID id,
            @RequestHeader(Constants.USER_ID_HEADER) Long touristId) {
        CallInitiation initiation = tripOrchestrator.initiateCall(id, touristId);
        CallInitiationResponse response = new CallInitiationResponse(
                TripResponse.from(initiation.trip()), CallJoinResponse.from(initiation.join()));
        return ResponseEntity.ok(BaseResponse.success("Call started successfully", response));
    }

    @PostMapping("/{id}/accept")
    public ResponseEntity<BaseResponse<TripResponse>> acceptTrip(
            @PathVariable UUID id,
            @RequestHeader(Constants.GUIDE_ID_HEADER) Long guideId) {
        TripResponse response = TripResponse.from(tripOrchestrator.guideAccept(id, guideId));
        return ResponseEntity.ok(BaseResponse.success("Trip accepted successfully", response));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<BaseResponse<TripResponse>> rejectTrip(
            @PathVariable UUID id,
            @RequestHeader(Constants.GUIDE_ID_HEADER) Long guideId,
            @Valid @RequestBody(required = false) RejectTripRequest request) {
        String reason = request != null ? request.reason() : null;
        TripResponse response = TripResponse.from(tripOrchestrator.guideReject(id, guideId, reason));
        return ResponseEntity.ok(BaseResponse.success("Trip rejected", response));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<TripResponse>> cancelTrip(
            @PathVariable UUID id,
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) Long userId,
            @RequestHeader(value = Constants.GUIDE_ID_HEADER, required = false) Long guideId,
            @Valid @RequestBody CancelTripRequest request) {
        Long actorId = request.role() == TripActor.GUIDE ? guideId : userId;
        if (actorId == null) {
            throw new ValidationException("Missing identity header for role " + request.role().getValue());
        }
        TripResponse response = TripResponse.from(tripOrchestrator.cancelTrip(actorId, id, request.reason(), request.role()));
        return ResponseEntity.ok(BaseResponse.success("Trip cancelled successfully", response));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<BaseResponse<TripResponse>> startTrip(
            @PathVariable UUID id,
            @RequestHeader(Constants.GUIDE_ID_HEADER) Long guideId) {
        return ResponseEntity.ok(BaseResponse.success("Trip started", TripResponse.from(tripOrchestrator.startTrip(guideId, id))));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<BaseResponse<TripResponse>> completeTrip(
            @PathVariable UUID id,
            @RequestHeader(Constants.GUIDE_ID_HEADER) Long guideId) {
        return ResponseEntity.ok(BaseResponse.success("Trip completed", TripResponse.from(tripOrchestrator.completeTrip(guideId, id))));
    }

    @PostMapping("/{id}/archive")
    public ResponseEntity<BaseResponse<TripResponse>> archiveTrip(
            @PathVariable UUID id,
            @RequestHeader(Constants.USER_ID_HEADER) Long touristId) {
        return ResponseEntity.ok(BaseResponse.success("Trip archived", TripResponse.from(tripOrchestrator.archiveTrip(touristId, id))));
    }

    @PostMapping("/{id}/review")
    public ResponseEntity<BaseResponse<TripResponse>> reviewTrip(
            @PathVariable UUID id,
            @RequestHeader(Constants.USER_ID_HEADER) Long touristId,
            @Valid @RequestBody ReviewTripRequest request) {
        TripResponse response = TripResponse.from(
                proposalService.reviewTrip(touristId, id, request.rating(), request.comment()));
        return ResponseEntity.ok(BaseResponse.success("Review submitted successfully", response));
    }

    @GetMapping("/{id}/proposals")
    public ResponseEntity<BaseResponse<List<ProposalResponse>>> listProposals(
            @PathVariable UUID id,
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) Long userId,
            @RequestHeader(value = Constants.GUIDE_ID_HEADER, required = false) Long guideId) {
        queryService.getTrip(id, userId, guideId);
        List<ProposalResponse> response = proposalService.listProposals(id).stream().map(ProposalResponse::from).toList();
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/{id}/proposals")
    public ResponseEntity<BaseResponse<ProposalResponse>> proposeChange(
            @PathVariable UUID id,
            @RequestHeader(Constants.GUIDE_ID_HEADER) Long guideId,
            @Valid @RequestBody ProposeChangeRequest request) {
        ProposalResponse response = ProposalResponse.from(proposalService.proposeChange(guideId, id, request));
        return ResponseEntity.ok(BaseResponse.success("Change proposed successfully", response));
    }

    @PostMapping("/{id}/proposals/accept")
    public ResponseEntity<BaseResponse<TripResponse>> acceptProposal(
            @PathVariable UUID id,
            @RequestHeader(Constants.USER_ID_HEADER) Long touristId) {
        TripResponse response = TripResponse.from(proposalService.acceptProposal(touristId, id));
        return ResponseEntity.ok(BaseResponse.success("Proposal accepted", response));
    }

    @PostMapping("/{id}/proposals/reject")
    public ResponseEntity<BaseResponse<ProposalResponse>> rejectProposal(
            @PathVariable UUID id,
            @RequestHeader(Constants.USER_ID_HEADER) Long touristId,
            @Valid @RequestBody(required = false) RejectProposalRequest request) {
        String note = request != null ? request.note() : null;
        ProposalResponse response = ProposalResponse.from(proposalService.rejectProposal(touristId, id, note));
        return ResponseEntity.ok(BaseResponse.success("Proposal rejected", response));
    }

    @PostMapping("/{id}/checkout")
    public ResponseEntity<BaseResponse<CheckoutSessionResponse>> createCheckoutSession(
            @PathVariable UUID id,
            @RequestHeader(Constants.USER_ID_HEADER) Long touristId) {
        CheckoutSessionResponse response = checkoutService.createCheckoutSession(touristId, id);
        return ResponseEntity.ok(BaseResponse.success("Checkout session created", response));
    }

    private static TripCreatedResponse toResponse(TripCreation creation) {
        return new TripCreatedResponse(TripResponse.from(creation.trip()),
                CandidateGuidesResponse.from(creation.candidates()));
    }
}
