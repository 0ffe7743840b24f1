package com.openguide.trip.api.dto;

import com.openguide.trip.domain.model.ProposalStatus;
import com.openguide.trip.domain.model.TripProposal;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ProposalResponse(
        UUID id,
        UUID tripId,
        Long guideId,
        Instant proposedStartAt,
        List<TripResponse.Stop> proposedItinerary,
        String note,
        ProposalStatus status,
        String responseNote,
        Instant createdAt,
        Instant resolvedAt
) {
    public static ProposalResponse from(TripProposal proposal) {
        return new ProposalResponse(
                proposal.getId(),
                proposal.getTripId(),
                proposal.getGuideId(),
                proposal.getProposedStartAt(),
                proposal.getProposedItinerary().stream().map(TripResponse.Stop::from).toList(),
                proposal.getNote(),
                proposal.getStatus(),
                proposal.getResponseNote(),
                proposal.getCreatedAt(),
                proposal.getResolvedAt()
        );
    }
}
