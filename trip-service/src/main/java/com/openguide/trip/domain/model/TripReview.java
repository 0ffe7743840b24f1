package com.openguide.trip.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Embeddable
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripReview {

    @Column(name = "review_rating")
    private Integer rating;

    @Column(name = "review_comment", length = 2000)
    private String comment;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;
}
