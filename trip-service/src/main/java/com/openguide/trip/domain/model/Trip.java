package com.openguide.trip.domain.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A tourist's trip request and its negotiation, payment and execution state.
 * <p>
 * Status changes only through {@code TripStore#updateIfStatus}; never set {@link #status} on a managed
 * instance and rely on dirty checking.
 */
@Entity
@Table(name = "trips", indexes = {
        @Index(name = "idx_trips_tourist_id", columnList = "tourist_id"),
        @Index(name = "idx_trips_selected_guide_id", columnList = "selected_guide_id"),
        @Index(name = "idx_trips_status", columnList = "status"),
        @Index(name = "idx_trips_source_call_id", columnList = "source_call_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trip {

    public static final int DEFAULT_DURATION_MINUTES = 240;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tourist_id", nullable = false, updatable = false)
    private Long touristId;

    @Column(name = "selected_guide_id")
    private Long selectedGuideId;

    /** Candidate cache: active guides of the province, best rated first. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trip_candidate_guides", joinColumns = @JoinColumn(name = "trip_id"))
    @OrderColumn(name = "position")
    @Column(name = "guide_id", nullable = false)
    @Builder.Default
    private List<Long> candidateGuideIds = new ArrayList<>();

    @Column(name = "province_id", nullable = false)
    private Long provinceId;

    @Column(name = "created_from_place_id")
    private Long createdFromPlaceId;

    @Column(name = "source_call_id")
    private UUID sourceCallId;

    @Column(name = "start_at", nullable = false)
    private Instant startAt;

    @Column(name = "total_duration_minutes")
    private Integer totalDurationMinutes;

    @Column(name = "end_at")
    private Instant endAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trip_itinerary_stops", joinColumns = @JoinColumn(name = "trip_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<ItineraryStop> itinerary = new ArrayList<>();

    @PositiveOrZero
    @Column(name = "negotiated_price", precision = 10, scale = 2)
    private BigDecimal negotiatedPrice;

    @Embedded
    private PriceBreakdown priceBreakdown;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "payment_session_id")
    private String paymentSessionId;

    @Column(name = "payment_intent_id")
    private String paymentIntentId;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "latitude", column = @Column(name = "meeting_latitude")),
            @AttributeOverride(name = "longitude", column = @Column(name = "meeting_longitude"))
    })
    private GeoPoint meetingPoint;

    @Column(name = "meeting_address", length = 500)
    private String meetingAddress;

    @Column(name = "notes", length = 2000)
    private String notes;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trip_call_records", joinColumns = @JoinColumn(name = "trip_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<CallRecord> callRecords = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private TripStatus status;

    @Column(name = "cancellation_reason", length = 1000)
    private String cancellationReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancelled_by", length = 20)
    private TripActor cancelledBy;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Embedded
    private TripReview review;

    @Column(name = "active_proposal_id")
    private UUID activeProposalId;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (status == null) {
            status = TripStatus.DRAFT;
        }
        if (paymentStatus == null) {
            paymentStatus = PaymentStatus.UNPAID;
        }
    }

    /** The guide bound to this trip, if any. */
    @Transient
    public Long getGuideId() {
        return selectedGuideId;
    }

    public int effectiveDurationMinutes() {
        return totalDurationMinutes != null ? totalDurationMinutes : DEFAULT_DURATION_MINUTES;
    }

    public Optional<CallRecord> findCallRecord(UUID callId) {
        return callRecords.stream().filter(r -> r.getCallId().equals(callId)).findFirst();
    }

    public void replaceCandidateGuides(List<Long> guideIds) {
        candidateGuideIds.clear();
        candidateGuideIds.addAll(guideIds);
    }

    public void replaceItinerary(List<ItineraryStop> stops) {
        itinerary.clear();
        stops.forEach(stop -> itinerary.add(stop.copy()));
    }

    public void clearCancellation() {
        cancellationReason = null;
        cancelledBy = null;
        cancelledAt = null;
    }

    public boolean hasReview() {
        return review != null && review.getRating() != null;
    }
}
