package com.openguide.trip.api.dto;

import com.openguide.trip.domain.model.CallRecord;
import com.openguide.trip.domain.model.ItineraryStop;
import com.openguide.trip.domain.model.PaymentStatus;
import com.openguide.trip.domain.model.PriceBreakdown;
import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.model.TripActor;
import com.openguide.trip.domain.model.TripReview;
import com.openguide.trip.domain.model.TripStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record TripResponse(
        UUID id,
        Long touristId,
        Long guideId,
        List<Long> candidateGuideIds,
        Long provinceId,
        Long createdFromPlaceId,
        Instant startAt,
        Integer totalDurationMinutes,
        Instant endAt,
        List<Stop> itinerary,
        BigDecimal negotiatedPrice,
        PriceBreakdown priceBreakdown,
        String currency,
        PaymentStatus paymentStatus,
        Double meetingLatitude,
        Double meetingLongitude,
        String meetingAddress,
        String notes,
        List<Call> callRecords,
        TripStatus status,
        String cancellationReason,
        TripActor cancelledBy,
        Instant cancelledAt,
        TripReview review,
        UUID activeProposalId,
        Instant confirmedAt,
        Instant createdAt,
        Instant updatedAt
) {
    public record Stop(Long placeId, Integer visitDurationMinutes, String notes, boolean ticketRequired) {
        static Stop from(ItineraryStop stop) {
            return new Stop(stop.getPlaceId(), stop.getVisitDurationMinutes(), stop.getNotes(), stop.isTicketRequired());
        }
    }

    public record Call(UUID callId, Long guideId, Instant startedAt, Instant endedAt, Long durationSeconds,
                       String summary, BigDecimal negotiatedPrice) {
        static Call from(CallRecord record) {
            return new Call(record.getCallId(), record.getGuideId(), record.getStartedAt(), record.getEndedAt(),
                    record.getDurationSeconds(), record.getSummary(), record.getNegotiatedPrice());
        }
    }

    public static TripResponse from(Trip trip) {
        return new TripResponse(
                trip.getId(),
                trip.getTouristId(),
                trip.getGuideId(),
                List.copyOf(trip.getCandidateGuideIds()),
                trip.getProvinceId(),
                trip.getCreatedFromPlaceId(),
                trip.getStartAt(),
                trip.getTotalDurationMinutes(),
                trip.getEndAt(),
                trip.getItinerary().stream().map(Stop::from).toList(),
                trip.getNegotiatedPrice(),
                trip.getPriceBreakdown(),
                trip.getCurrency(),
                trip.getPaymentStatus(),
                trip.getMeetingPoint() != null ? trip.getMeetingPoint().getLatitude() : null,
                trip.getMeetingPoint() != null ? trip.getMeetingPoint().getLongitude() : null,
                trip.getMeetingAddress(),
                trip.getNotes(),
                trip.getCallRecords().stream().map(Call::from).toList(),
                trip.getStatus(),
                trip.getCancellationReason(),
                trip.getCancelledBy(),
                trip.getCancelledAt(),
                trip.getReview(),
                trip.getActiveProposalId(),
                trip.getConfirmedAt(),
                trip.getCreatedAt(),
                trip.getUpdatedAt()
        );
    }
}
