package com.openguide.trip.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A live negotiation call between a tourist and a guide. Hard-capped at {@link #maxDurationSeconds}.
 */
@Entity
@Table(name = "call_sessions", indexes = {
        @Index(name = "idx_call_sessions_trip_id", columnList = "trip_id"),
        @Index(name = "idx_call_sessions_status_deadline", columnList = "status, deadline_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "trip_id")
    private UUID tripId;

    @Column(name = "channel_name", nullable = false, unique = true, length = 80)
    private String channelName;

    @Column(name = "tourist_user_id", nullable = false)
    private Long touristUserId;

    @Column(name = "guide_user_id", nullable = false)
    private Long guideUserId;

    @Column(name = "tourist_uid", nullable = false)
    private Integer touristUid;

    @Column(name = "guide_uid", nullable = false)
    private Integer guideUid;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CallStatus status;

    @Column(name = "max_duration_seconds", nullable = false)
    private Integer maxDurationSeconds;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "deadline_at", nullable = false)
    private Instant deadlineAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "end_reason", length = 30)
    private CallEndReason endReason;

    @Column(name = "summary", length = 2000)
    private String summary;

    @Column(name = "negotiated_price", precision = 10, scale = 2)
    private BigDecimal negotiatedPrice;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isFinished() {
        return status != null && !status.isLive();
    }

    public boolean isParticipant(Long userId) {
        return userId != null && (userId.equals(touristUserId) || userId.equals(guideUserId));
    }
}
