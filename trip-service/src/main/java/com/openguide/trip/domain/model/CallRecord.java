package com.openguide.trip.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Denormalized copy of one negotiation call, kept on the trip after the live session is gone.
 */
@Embeddable
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallRecord {

    static final String DEFAULT_SUMMARY = "Call completed";

    @Column(name = "call_id", nullable = false)
    private UUID callId;

    @Column(name = "guide_id", nullable = false)
    private Long guideId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "duration_seconds")
    private Long durationSeconds;

    @Column(name = "summary", length = 2000)
    private String summary;

    @Column(name = "negotiated_price", precision = 10, scale = 2)
    private BigDecimal negotiatedPrice;

    public void close(Instant endedAt, String summary, BigDecimal negotiatedPrice) {
        this.endedAt = endedAt;
        this.durationSeconds = Math.max(0L, Duration.between(startedAt, endedAt).getSeconds());
        this.summary = summary != null ? summary : DEFAULT_SUMMARY;
        if (negotiatedPrice != null) {
            this.negotiatedPrice = negotiatedPrice;
        }
    }
}
