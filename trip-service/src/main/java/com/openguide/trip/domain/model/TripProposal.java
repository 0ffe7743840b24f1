package com.openguide.trip.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A guide's proposed change to the itinerary or start time of a confirmed trip.
 */
@Entity
@Table(name = "trip_proposals", indexes = {
        @Index(name = "idx_trip_proposals_trip_id", columnList = "trip_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripProposal {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "trip_id", nullable = false, updatable = false)
    private UUID tripId;

    @Column(name = "guide_id", nullable = false, updatable = false)
    private Long guideId;

    @Column(name = "proposed_start_at", nullable = false)
    private Instant proposedStartAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trip_proposal_stops", joinColumns = @JoinColumn(name = "proposal_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<ItineraryStop> proposedItinerary = new ArrayList<>();

    @Column(name = "note", length = 2000)
    private String note;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ProposalStatus status;

    @Column(name = "response_note", length = 2000)
    private String responseNote;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (status == null) {
            status = ProposalStatus.PENDING;
        }
    }

    public boolean isPending() {
        return status == ProposalStatus.PENDING;
    }

    public void resolve(ProposalStatus outcome, String responseNote, Instant at) {
        this.status = outcome;
        this.responseNote = responseNote;
        this.resolvedAt = at;
    }
}
